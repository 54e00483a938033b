package com.sunny.cron.core.action;

import com.sunny.cron.core.common.Assert;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 外部命令动作
 * <p>
 * 直接启动进程，不经过 shell 解释，因此不支持管道和重定向
 *
 * @param command 命令名或可执行文件路径
 * @param args    参数列表
 * @author SunnyX6
 * @date 2025-12-13
 */
public record ShellAction(String command, List<String> args) implements Action {

    public ShellAction {
        Assert.notBlank(command, "command 不能为空");
        args = args == null ? List.of() : List.copyOf(args);
    }

    /**
     * 按空白拆分命令字符串，第一段为命令名
     *
     * @param commandLine 例如 "echo hello world"
     */
    public static ShellAction parse(String commandLine) {
        Assert.notBlank(commandLine, "命令不能为空");
        String[] parts = commandLine.trim().split("\\s+");
        return new ShellAction(parts[0], Arrays.asList(parts).subList(1, parts.length));
    }

    /**
     * 完整命令行（命令 + 参数），用于 ProcessBuilder
     */
    public List<String> commandLine() {
        List<String> line = new ArrayList<>(args.size() + 1);
        line.add(command);
        line.addAll(args);
        return line;
    }

    @Override
    public String displayName() {
        return String.join(" ", commandLine());
    }
}
