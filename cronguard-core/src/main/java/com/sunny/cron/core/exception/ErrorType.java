package com.sunny.cron.core.exception;

/**
 * 统一错误类型常量
 *
 * @author Sunny
 * @date 2026-02-23
 */
public final class ErrorType {

    public static final String CONFIGURATION_INVALID = "CONFIGURATION_INVALID";
    public static final String JOB_LOAD_FAILED = "JOB_LOAD_FAILED";
    public static final String LOCK_TRANSPORT_FAILED = "LOCK_TRANSPORT_FAILED";
    public static final String ACTION_EXECUTION_FAILED = "ACTION_EXECUTION_FAILED";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private ErrorType() {
    }
}
