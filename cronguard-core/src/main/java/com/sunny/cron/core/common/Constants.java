package com.sunny.cron.core.common;

/**
 * 全局常量
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public final class Constants {

    private Constants() {
    }

    /**
     * 默认锁过期时间（毫秒），任务未配置 duration 时使用
     */
    public static final long DEFAULT_DURATION_MILLIS = 60_000L;

    /**
     * 锁 Key 中间段：{namespace}:cronjob:{jobId}
     */
    public static final String LOCK_KEY_SEGMENT = "cronjob";

    /**
     * 默认任务文件匹配规则
     */
    public static final String DEFAULT_JOB_FILE_PATTERN = "*.{yml,yaml,json}";

    /**
     * Action 输出保留的最大字符数
     */
    public static final int MAX_OUTPUT_CHARS = 4096;
}
