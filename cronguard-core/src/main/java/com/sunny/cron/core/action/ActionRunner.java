package com.sunny.cron.core.action;

import com.sunny.cron.core.common.Assert;
import com.sunny.cron.core.common.Constants;
import com.sunny.cron.core.exception.ActionExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Action 执行器
 * <p>
 * 执行策略（best-effort）：
 * - runOne 不向外抛异常（VirtualMachineError 除外）：命令非 0 退出、启动失败、超时、调用抛异常都只记录日志并返回失败结果
 * - runSeries 严格按顺序逐个执行，前一个结束后才开始下一个；某个 Action 失败不会跳过后续 Action
 * <p>
 * 外部命令的 stdout 与 stderr 合并后写入临时文件，执行结束后读取，避免管道写满阻塞子进程
 *
 * @author SunnyX6
 * @date 2025-12-14
 */
public class ActionRunner {

    private static final Logger log = LoggerFactory.getLogger(ActionRunner.class);

    /**
     * 子进程输出编码，取操作系统原生编码（JDK 17 的 native.encoding），与 file.encoding 无关
     */
    static final Charset OUTPUT_CHARSET = resolveOutputCharset(System.getProperty("native.encoding"));

    /**
     * 外部命令超时时间（秒），0 表示不限制
     */
    private final long timeoutSeconds;

    public ActionRunner() {
        this(0);
    }

    public ActionRunner(long timeoutSeconds) {
        this.timeoutSeconds = Assert.notNegative(timeoutSeconds, "timeoutSeconds 不能小于 0");
    }

    /**
     * 按顺序执行全部 Action
     *
     * @param actions Action 列表，可为空
     * @return 每个 Action 的执行结果，顺序与输入一致
     */
    public List<ActionResult> runSeries(List<Action> actions) {
        if (actions == null || actions.isEmpty()) {
            return List.of();
        }
        List<ActionResult> results = new ArrayList<>(actions.size());
        for (Action action : actions) {
            results.add(runOne(action));
        }
        return results;
    }

    /**
     * 执行单个 Action，失败只记录，不向外传播
     */
    public ActionResult runOne(Action action) {
        if (action == null) {
            log.warn("Action 为空，跳过");
            return ActionResult.failure("null", "Action 为空", 0);
        }
        String name = action.displayName();
        long startTime = System.currentTimeMillis();
        log.debug("Action: [{}] 开始执行", name);
        try {
            String output;
            if (action instanceof ShellAction shell) {
                output = runShell(shell);
            } else {
                output = runCallable((CallableAction) action);
            }
            long cost = System.currentTimeMillis() - startTime;
            log.debug("Action: [{}] 执行完成, cost={}ms", name, cost);
            return ActionResult.success(name, output, cost);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            long cost = System.currentTimeMillis() - startTime;
            log.warn("Action: [{}] 执行被中断", name);
            return ActionResult.failure(name, "执行被中断", cost);
        } catch (ActionExecutionException e) {
            long cost = System.currentTimeMillis() - startTime;
            log.warn("Action: [{}] 执行失败: {}", name, e.getMessage());
            return ActionResult.failure(name, e.getMessage(), cost);
        } catch (Exception e) {
            long cost = System.currentTimeMillis() - startTime;
            log.warn("Action: [{}] 执行异常", name, e);
            return ActionResult.failure(name, "执行异常: " + e.getMessage(), cost);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Error e) {
            long cost = System.currentTimeMillis() - startTime;
            log.warn("Action: [{}] 执行错误", name, e);
            return ActionResult.failure(name, "执行错误: " + e.getMessage(), cost);
        }
    }

    private String runShell(ShellAction action) throws InterruptedException {
        Path outputFile = null;
        Process process = null;
        try {
            outputFile = Files.createTempFile("cronguard-action-", ".log");
            ProcessBuilder pb = new ProcessBuilder(action.commandLine());
            pb.redirectErrorStream(true);
            pb.redirectOutput(outputFile.toFile());
            process = pb.start();

            boolean finished;
            if (timeoutSeconds > 0) {
                finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            } else {
                process.waitFor();
                finished = true;
            }
            if (!finished) {
                process.destroyForcibly();
                throw new ActionExecutionException(action.displayName(), "执行超时（%d秒）", timeoutSeconds);
            }

            String output = readOutput(outputFile);
            if (!output.isEmpty()) {
                log.debug("Action: [{}] 输出:\n{}", action.displayName(), output);
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new ActionExecutionException(action.displayName(), "退出码 %d: %s", exitCode, output);
            }
            return output;
        } catch (IOException e) {
            throw new ActionExecutionException(e, action.displayName(), "启动失败: %s", e.getMessage());
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            deleteQuietly(outputFile);
        }
    }

    private String runCallable(CallableAction action) throws Exception {
        Object result = action.callable().call();
        return result == null ? "" : truncate(String.valueOf(result));
    }

    private String readOutput(Path outputFile) throws IOException {
        String content = new String(Files.readAllBytes(outputFile), OUTPUT_CHARSET);
        return truncate(content.trim());
    }

    static Charset resolveOutputCharset(String nativeEncoding) {
        if (nativeEncoding == null || nativeEncoding.isBlank()) {
            return Charset.defaultCharset();
        }
        try {
            return Charset.forName(nativeEncoding);
        } catch (IllegalArgumentException e) {
            log.warn("不支持的 native.encoding: {}，使用默认编码 {}", nativeEncoding, Charset.defaultCharset());
            return Charset.defaultCharset();
        }
    }

    private String truncate(String text) {
        if (text.length() <= Constants.MAX_OUTPUT_CHARS) {
            return text;
        }
        return text.substring(0, Constants.MAX_OUTPUT_CHARS) + "...(truncated)";
    }

    private void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("删除临时输出文件失败: {}", file, e);
        }
    }
}
