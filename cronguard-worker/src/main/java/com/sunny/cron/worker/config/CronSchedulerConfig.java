package com.sunny.cron.worker.config;

import com.sunny.cron.core.action.ActionRunner;
import com.sunny.cron.core.exception.ConfigurationException;
import com.sunny.cron.core.handler.ActionHandlerRegistry;
import com.sunny.cron.core.job.JobDefinitionParser;
import com.sunny.cron.core.job.JobLoader;
import com.sunny.cron.core.lock.InMemoryLockClient;
import com.sunny.cron.core.lock.LockClient;
import com.sunny.cron.core.lock.RedisLockClient;
import com.sunny.cron.core.scheduler.SchedulerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 调度组件装配
 * <p>
 * - cronTicker：只负责按 cron 触发，回调立即投递到 cronTickExecutor
 * - cronTickExecutor：执行加锁、Action、解锁
 * - LockClient：lock-store=redis 使用 Spring Boot 自动配置的 StringRedisTemplate，memory 使用进程内实现
 *
 * @author SunnyX6
 * @date 2025-12-14
 */
@Configuration
@EnableConfigurationProperties(CronWorkerProperties.class)
public class CronSchedulerConfig {

    private static final Logger log = LoggerFactory.getLogger(CronSchedulerConfig.class);

    @Bean
    public ThreadPoolTaskScheduler cronTicker(CronWorkerProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("cron-ticker-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean
    public ThreadPoolTaskExecutor cronTickExecutor(CronWorkerProperties properties) {
        CronWorkerProperties.Executor config = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getCoreSize());
        executor.setMaxPoolSize(config.getMaxSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("cron-tick-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(properties.getAwaitTerminationSeconds());
        return executor;
    }

    @Bean
    public LockClient lockClient(CronWorkerProperties properties,
                                 ObjectProvider<StringRedisTemplate> redisTemplateProvider) {
        if (properties.getLockStore() == CronWorkerProperties.LockStore.MEMORY) {
            log.warn("使用进程内锁（lock-store=memory），多实例部署时无法互斥");
            return new InMemoryLockClient();
        }
        StringRedisTemplate redisTemplate = redisTemplateProvider.getIfAvailable();
        if (redisTemplate == null) {
            throw new ConfigurationException("lock-store=redis 但未找到 StringRedisTemplate，请检查 spring.data.redis 配置");
        }
        log.info("使用 Redis 分布式锁");
        return new RedisLockClient(redisTemplate);
    }

    @Bean
    public ActionRunner actionRunner(CronWorkerProperties properties) {
        return new ActionRunner(properties.getActionTimeoutSeconds());
    }

    @Bean
    public JobDefinitionParser jobDefinitionParser(ActionHandlerRegistry actionHandlerRegistry) {
        return new JobDefinitionParser(actionHandlerRegistry);
    }

    @Bean
    public JobLoader jobLoader(JobDefinitionParser parser, CronWorkerProperties properties) {
        return new JobLoader(parser,
                properties.getJobFilePattern(),
                properties.isFailOnInvalidJob(),
                properties.getEnv());
    }

    @Bean
    public SchedulerSettings schedulerSettings(CronWorkerProperties properties) {
        String namespace = properties.getNamespace();
        if (namespace == null || namespace.isBlank()) {
            throw new ConfigurationException("cronguard.worker.namespace 不能为空");
        }
        if (properties.getDefaultDurationMs() <= 0) {
            throw new ConfigurationException("cronguard.worker.default-duration-ms 必须大于 0，实际: %d",
                    properties.getDefaultDurationMs());
        }
        return new SchedulerSettings(namespace, properties.getDefaultDurationMs(), properties.getZone());
    }
}
