package com.sunny.cron.core.exception;

import java.util.Map;

/**
 * 任务文件加载异常
 * 上下文中的 file 字段为出错的任务文件名
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class JobLoadException extends CronRuntimeException {

    public JobLoadException(String file, String message, Object... args) {
        super(ErrorType.JOB_LOAD_FAILED, Map.of("file", file), false, prefix(file, message, args));
    }

    public JobLoadException(Throwable cause, String file, String message, Object... args) {
        super(cause, ErrorType.JOB_LOAD_FAILED, Map.of("file", file), false, prefix(file, message, args));
    }

    public String getFile() {
        return getContext().get("file");
    }

    private static String prefix(String file, String message, Object... args) {
        String detail = args == null || args.length == 0 ? message : String.format(message, args);
        return "[" + file + "] " + detail;
    }
}
