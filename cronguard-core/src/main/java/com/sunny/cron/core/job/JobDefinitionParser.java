package com.sunny.cron.core.job;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.sunny.cron.core.action.Action;
import com.sunny.cron.core.action.CallableAction;
import com.sunny.cron.core.action.ShellAction;
import com.sunny.cron.core.cron.CronUtils;
import com.sunny.cron.core.exception.JobLoadException;
import com.sunny.cron.core.handler.ActionHandlerRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * 任务文件解析器
 * <p>
 * 任务文件为 YAML（JSON 也可直接读取），结构见 {@link JobFile}。duration 只接受整数毫秒，小数直接拒绝。
 * 解析后做显式校验，任何不合法内容都抛出 {@link JobLoadException} 并带上文件名
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public class JobDefinitionParser {

    private static final String FIELD_COMMAND = "command";
    private static final String FIELD_ARGS = "args";
    private static final String FIELD_HANDLER = "handler";
    private static final Set<String> ACTION_FIELDS = Set.of(FIELD_COMMAND, FIELD_ARGS, FIELD_HANDLER);

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);

    /**
     * 可为空，为空时任务文件不能引用 handler
     */
    private final ActionHandlerRegistry handlerRegistry;

    public JobDefinitionParser() {
        this(null);
    }

    public JobDefinitionParser(ActionHandlerRegistry handlerRegistry) {
        this.handlerRegistry = handlerRegistry;
    }

    /**
     * 解析任务文件，任务 ID 为文件名
     */
    public JobDefinition parse(Path file) {
        String fileName = file.getFileName().toString();
        try (InputStream in = Files.newInputStream(file)) {
            return parse(fileName, in);
        } catch (IOException e) {
            throw new JobLoadException(e, fileName, "读取失败: %s", e.getMessage());
        }
    }

    /**
     * 解析任务内容
     *
     * @param fileName 文件名（任务 ID）
     * @param in       文件内容
     */
    public JobDefinition parse(String fileName, InputStream in) {
        JobFile jobFile;
        try {
            jobFile = mapper.readValue(in, JobFile.class);
        } catch (UnrecognizedPropertyException e) {
            throw new JobLoadException(e, fileName, "未知属性: %s", e.getPropertyName());
        } catch (JacksonException e) {
            throw new JobLoadException(e, fileName, "解析失败: %s", e.getOriginalMessage());
        } catch (IOException e) {
            throw new JobLoadException(e, fileName, "读取失败: %s", e.getMessage());
        }
        if (jobFile == null) {
            throw new JobLoadException(fileName, "文件内容为空");
        }
        return convert(fileName, jobFile);
    }

    private JobDefinition convert(String fileName, JobFile jobFile) {
        String schedule = jobFile.schedule();
        if (schedule == null || schedule.isBlank()) {
            throw new JobLoadException(fileName, "缺少 schedule");
        }
        try {
            CronUtils.parse(schedule);
        } catch (IllegalArgumentException e) {
            throw new JobLoadException(e, fileName, "schedule 无效: %s", e.getMessage());
        }

        Long duration = jobFile.duration();
        if (duration != null && duration <= 0) {
            throw new JobLoadException(fileName, "duration 必须大于 0，实际: %d", duration);
        }

        if (jobFile.actions() == null) {
            throw new JobLoadException(fileName, "缺少 actions");
        }
        List<Action> actions = new ArrayList<>(jobFile.actions().size());
        for (int i = 0; i < jobFile.actions().size(); i++) {
            actions.add(convertAction(fileName, i, jobFile.actions().get(i)));
        }

        return new JobDefinition(fileName,
                schedule.trim(),
                duration,
                actions,
                Boolean.TRUE.equals(jobFile.disabled()),
                jobFile.env());
    }

    private Action convertAction(String fileName, int index, JsonNode node) {
        if (node == null || node.isNull()) {
            throw new JobLoadException(fileName, "actions[%d] 为空", index);
        }
        if (node.isTextual()) {
            String commandLine = node.asText();
            if (commandLine.isBlank()) {
                throw new JobLoadException(fileName, "actions[%d] 命令为空", index);
            }
            return ShellAction.parse(commandLine);
        }
        if (!node.isObject()) {
            throw new JobLoadException(fileName, "actions[%d] 必须是字符串或对象", index);
        }

        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!ACTION_FIELDS.contains(name)) {
                throw new JobLoadException(fileName, "actions[%d] 未知属性: %s", index, name);
            }
        }

        boolean hasCommand = node.has(FIELD_COMMAND);
        boolean hasHandler = node.has(FIELD_HANDLER);
        if (hasCommand == hasHandler) {
            throw new JobLoadException(fileName, "actions[%d] 必须且只能包含 command 或 handler 之一", index);
        }
        if (hasHandler) {
            return convertHandler(fileName, index, node);
        }
        return convertCommand(fileName, index, node);
    }

    private Action convertCommand(String fileName, int index, JsonNode node) {
        JsonNode command = node.get(FIELD_COMMAND);
        if (!command.isTextual() || command.asText().isBlank()) {
            throw new JobLoadException(fileName, "actions[%d] command 为空", index);
        }
        List<String> args = new ArrayList<>();
        JsonNode argsNode = node.get(FIELD_ARGS);
        if (argsNode != null && !argsNode.isNull()) {
            if (!argsNode.isArray()) {
                throw new JobLoadException(fileName, "actions[%d] args 必须是数组", index);
            }
            for (JsonNode arg : argsNode) {
                if (!arg.isValueNode() || arg.isNull()) {
                    throw new JobLoadException(fileName, "actions[%d] args 只能包含标量值", index);
                }
                args.add(arg.asText());
            }
        }
        return new ShellAction(command.asText().trim(), args);
    }

    private Action convertHandler(String fileName, int index, JsonNode node) {
        if (node.has(FIELD_ARGS)) {
            throw new JobLoadException(fileName, "actions[%d] handler 不支持 args", index);
        }
        JsonNode handler = node.get(FIELD_HANDLER);
        if (!handler.isTextual() || handler.asText().isBlank()) {
            throw new JobLoadException(fileName, "actions[%d] handler 为空", index);
        }
        String name = handler.asText().trim();
        Callable<?> callable = handlerRegistry == null ? null : handlerRegistry.getHandler(name);
        if (callable == null) {
            throw new JobLoadException(fileName, "actions[%d] handler 未注册: %s", index, name);
        }
        return new CallableAction(name, callable);
    }
}
