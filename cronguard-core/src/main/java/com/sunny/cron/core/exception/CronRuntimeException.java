package com.sunny.cron.core.exception;

import java.util.Map;

/**
 * 调度运行时异常基类
 * 描述错误类型、上下文与是否可重试
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class CronRuntimeException extends RuntimeException {

    private final String type;
    private final Map<String, String> context;
    private final boolean retryable;

    protected CronRuntimeException(String type,
                                   Map<String, String> context,
                                   boolean retryable,
                                   String message,
                                   Object... args) {
        this(type, context, retryable, null, format(message, args));
    }

    protected CronRuntimeException(Throwable cause,
                                   String type,
                                   Map<String, String> context,
                                   boolean retryable,
                                   String message,
                                   Object... args) {
        this(type, context, retryable, cause, format(message, args));
    }

    private CronRuntimeException(String type,
                                 Map<String, String> context,
                                 boolean retryable,
                                 Throwable cause,
                                 String message) {
        super(message, cause);
        this.type = type == null ? ErrorType.INTERNAL_ERROR : type;
        this.context = context == null ? Map.of() : Map.copyOf(context);
        this.retryable = retryable;
    }

    public String getType() {
        return type;
    }

    public Map<String, String> getContext() {
        return context;
    }

    public boolean isRetryable() {
        return retryable;
    }

    private static String format(String message, Object... args) {
        if (message == null) {
            return "";
        }
        if (args == null || args.length == 0) {
            return message;
        }
        return String.format(message, args);
    }
}
