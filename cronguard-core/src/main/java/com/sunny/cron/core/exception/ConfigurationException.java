package com.sunny.cron.core.exception;

import java.util.Map;

/**
 * 配置异常
 * 任务目录缺失、命名空间为空、存储不可达等启动期错误，调度器不会启动
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class ConfigurationException extends CronRuntimeException {

    public ConfigurationException(String message, Object... args) {
        super(ErrorType.CONFIGURATION_INVALID, null, false, message, args);
    }

    public ConfigurationException(Throwable cause, String message, Object... args) {
        super(cause, ErrorType.CONFIGURATION_INVALID, null, false, message, args);
    }

    public ConfigurationException(Map<String, String> context, String message, Object... args) {
        super(ErrorType.CONFIGURATION_INVALID, context, false, message, args);
    }
}
