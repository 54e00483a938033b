package com.sunny.cron.worker.service;

import com.sunny.cron.core.action.ActionRunner;
import com.sunny.cron.core.job.JobLoader;
import com.sunny.cron.core.job.JobRegistry;
import com.sunny.cron.core.lock.LockClient;
import com.sunny.cron.core.scheduler.CronJobScheduler;
import com.sunny.cron.core.scheduler.SchedulerSettings;
import com.sunny.cron.worker.config.CronWorkerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executor;

/**
 * Worker 生命周期服务
 * <p>
 * 在容器完成初始化（包括 @CronAction 扫描和插件加载）之后启动：
 * 1. 检查 Redis 连通性
 * 2. 加载任务目录
 * 3. 注册触发器
 * <p>
 * 任何一步失败都会中止启动，不会出现部分任务已调度的状态。
 * 关闭时先取消触发器，执行中的 tick 由 cronTickExecutor 等待完成
 *
 * @author SunnyX6
 * @date 2025-12-14
 */
@Service
public class CronWorkerLifecycleService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(CronWorkerLifecycleService.class);

    private final CronWorkerProperties properties;
    private final StoreConnectionVerifier storeConnectionVerifier;
    private final JobLoader jobLoader;
    private final LockClient lockClient;
    private final ActionRunner actionRunner;
    private final TaskScheduler ticker;
    private final Executor tickExecutor;
    private final SchedulerSettings settings;

    private volatile CronJobScheduler scheduler;

    private volatile boolean running = false;

    public CronWorkerLifecycleService(CronWorkerProperties properties,
                                      StoreConnectionVerifier storeConnectionVerifier,
                                      JobLoader jobLoader,
                                      LockClient lockClient,
                                      ActionRunner actionRunner,
                                      @Qualifier("cronTicker") TaskScheduler ticker,
                                      @Qualifier("cronTickExecutor") Executor tickExecutor,
                                      SchedulerSettings settings) {
        this.properties = properties;
        this.storeConnectionVerifier = storeConnectionVerifier;
        this.jobLoader = jobLoader;
        this.lockClient = lockClient;
        this.actionRunner = actionRunner;
        this.ticker = ticker;
        this.tickExecutor = tickExecutor;
        this.settings = settings;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        log.info("Worker 启动: namespace={}, cronDir={}", settings.namespace(), properties.getCronDir());

        storeConnectionVerifier.verify();
        JobRegistry registry = jobLoader.load(properties.getCronDir());
        CronJobScheduler jobScheduler = new CronJobScheduler(registry, lockClient, actionRunner,
                ticker, tickExecutor, settings);
        int registered = jobScheduler.start();

        this.scheduler = jobScheduler;
        running = true;
        log.info("Worker 启动完成: jobs={}, scheduled={}", registry.size(), registered);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("Worker 关闭: namespace={}", settings.namespace());
        scheduler.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * 当前调度器，未启动时返回 null
     */
    public CronJobScheduler getScheduler() {
        return scheduler;
    }
}
