package com.sunny.cron.core.exception;

import java.util.Map;

/**
 * 锁存储通信异常
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class LockTransportException extends CronRuntimeException {

    public LockTransportException(Throwable cause, String key, String message, Object... args) {
        super(cause, ErrorType.LOCK_TRANSPORT_FAILED, Map.of("key", key), true, message, args);
    }

    public String getKey() {
        return getContext().get("key");
    }
}
