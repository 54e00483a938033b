package com.sunny.cron.core.action;

/**
 * 任务动作
 * <p>
 * 两种形式：
 * <ul>
 *     <li>{@link ShellAction}：外部命令（命令名 + 参数列表）</li>
 *     <li>{@link CallableAction}：进程内无参调用，带可选显示名</li>
 * </ul>
 * Action 只被调用，不保存任何状态
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public sealed interface Action permits ShellAction, CallableAction {

    /**
     * 日志中使用的显示名
     */
    String displayName();
}
