package com.sunny.cron.worker.config;

import com.sunny.cron.core.common.Constants;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

/**
 * Worker 配置属性
 *
 * @author SunnyX6
 * @date 2025-12-14
 */
@Data
@ConfigurationProperties(prefix = "cronguard.worker")
public class CronWorkerProperties {

    /**
     * 任务文件目录（必填）
     */
    private String cronDir;

    /**
     * 锁 Key 前缀
     */
    private String namespace;

    private String jobFilePattern = Constants.DEFAULT_JOB_FILE_PATTERN;

    /**
     * 任务未配置 duration 时的锁过期时间（毫秒）
     */
    private long defaultDurationMs = Constants.DEFAULT_DURATION_MILLIS;

    /**
     * 当前环境，为空时不按 env 过滤任务
     */
    private String env;

    private boolean failOnInvalidJob = true;

    /**
     * 外部命令超时时间（秒），0 表示不限制
     */
    private long actionTimeoutSeconds = 0;

    /**
     * cron 计算时区，为空时使用系统时区
     */
    private ZoneId zone;

    private LockStore lockStore = LockStore.REDIS;

    /**
     * 启动前检查 Redis 连通性
     */
    private boolean verifyStoreOnStartup = true;

    private int schedulerPoolSize = 2;

    private Executor executor = new Executor();

    /**
     * 关闭时等待执行中 tick 的最长时间（秒）
     */
    private int awaitTerminationSeconds = 30;

    private String pluginsDir = "plugins";

    @Data
    public static class Executor {
        private int coreSize = 4;
        private int maxSize = 16;
        private int queueCapacity = 100;
    }

    public enum LockStore {
        /**
         * 共享 Redis，多实例部署
         */
        REDIS,
        /**
         * 进程内存，仅适用于单实例
         */
        MEMORY
    }
}
