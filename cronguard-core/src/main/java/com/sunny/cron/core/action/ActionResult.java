package com.sunny.cron.core.action;

/**
 * 单个 Action 的执行结果
 *
 * @param action   Action 显示名
 * @param success  是否成功
 * @param message  成功时为捕获的输出，失败时为错误信息
 * @param costMillis 耗时（毫秒）
 * @author SunnyX6
 * @date 2025-12-13
 */
public record ActionResult(String action, boolean success, String message, long costMillis) {

    public static ActionResult success(String action, String output, long costMillis) {
        return new ActionResult(action, true, output, costMillis);
    }

    public static ActionResult failure(String action, String message, long costMillis) {
        return new ActionResult(action, false, message, costMillis);
    }
}
