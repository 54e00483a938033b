package com.sunny.cron.core.exception;

import java.util.Map;

/**
 * Action 执行异常
 * 只在 ActionRunner 内部使用，不会传播到 runOne 之外
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class ActionExecutionException extends CronRuntimeException {

    public ActionExecutionException(String action, String message, Object... args) {
        super(ErrorType.ACTION_EXECUTION_FAILED, Map.of("action", action), false, message, args);
    }

    public ActionExecutionException(Throwable cause, String action, String message, Object... args) {
        super(cause, ErrorType.ACTION_EXECUTION_FAILED, Map.of("action", action), false, message, args);
    }
}
