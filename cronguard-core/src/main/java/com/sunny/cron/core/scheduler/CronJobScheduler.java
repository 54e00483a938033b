package com.sunny.cron.core.scheduler;

import com.sunny.cron.core.action.ActionResult;
import com.sunny.cron.core.action.ActionRunner;
import com.sunny.cron.core.common.Assert;
import com.sunny.cron.core.cron.CronUtils;
import com.sunny.cron.core.job.JobDefinition;
import com.sunny.cron.core.job.JobRegistry;
import com.sunny.cron.core.lock.FencingTokens;
import com.sunny.cron.core.lock.LockClient;
import com.sunny.cron.core.lock.LockKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * 分布式互斥 Cron 调度器
 * <p>
 * 每个启用的任务注册一个 CronTrigger，触发回调只负责把 tick 投递到 tickExecutor，不阻塞触发线程。
 * 每次 tick 的流程：
 * 1. 生成随机 token，以 {namespace}:cronjob:{jobId} 为 key 加锁（NX + 过期时间）
 * 2. 未获取到锁直接跳过，不做释放
 * 3. 获取到锁后按顺序执行全部 Action
 * 4. 无论 Action 成功与否都尝试用同一个 token 释放锁
 * <p>
 * 锁过期时间固定，不做续期；执行时间超过过期时间时只告警
 *
 * @author SunnyX6
 * @date 2025-12-14
 */
public class CronJobScheduler {

    private static final Logger log = LoggerFactory.getLogger(CronJobScheduler.class);

    private final JobRegistry registry;
    private final LockClient lockClient;
    private final ActionRunner actionRunner;
    private final TaskScheduler ticker;
    private final Executor tickExecutor;
    private final SchedulerSettings settings;

    /**
     * jobId -> 触发器句柄，防止重复注册
     */
    private final Map<String, ScheduledFuture<?>> registrations = new ConcurrentHashMap<>();

    /**
     * jobId -> 最近一次状态变更
     * <p>
     * 只按 jobId 记录，同一任务的 tick 重叠时以最后写入为准，仅用于诊断
     */
    private final Map<String, JobTickState> states = new ConcurrentHashMap<>();

    public CronJobScheduler(JobRegistry registry,
                            LockClient lockClient,
                            ActionRunner actionRunner,
                            TaskScheduler ticker,
                            Executor tickExecutor,
                            SchedulerSettings settings) {
        this.registry = Assert.notNull(registry, "registry 不能为空");
        this.lockClient = Assert.notNull(lockClient, "lockClient 不能为空");
        this.actionRunner = Assert.notNull(actionRunner, "actionRunner 不能为空");
        this.ticker = Assert.notNull(ticker, "ticker 不能为空");
        this.tickExecutor = Assert.notNull(tickExecutor, "tickExecutor 不能为空");
        this.settings = Assert.notNull(settings, "settings 不能为空");
    }

    /**
     * 为所有启用且尚未注册的任务注册触发器
     *
     * @return 本次新注册的任务数
     */
    public synchronized int start() {
        int count = 0;
        for (JobDefinition job : registry.enabledJobs().toList()) {
            if (registrations.containsKey(job.id())) {
                continue;
            }
            CronTrigger trigger = new CronTrigger(CronUtils.toSpringExpression(job.schedule()), settings.zone());
            ScheduledFuture<?> future = ticker.schedule(() -> dispatch(job), trigger);
            if (future == null) {
                log.warn("任务触发器注册失败，该任务不会被触发: jobId={}, schedule={}", job.id(), job.schedule());
                continue;
            }
            registrations.put(job.id(), future);
            states.put(job.id(), JobTickState.IDLE);
            count++;
            log.info("注册任务: jobId={}, schedule={}, zone={}", job.id(), job.schedule(), settings.zone());
        }
        log.info("调度器启动: namespace={}, registered={}, total={}", settings.namespace(), count, registrations.size());
        return count;
    }

    /**
     * 取消全部触发器，正在执行的 tick 不受影响
     */
    public synchronized void stop() {
        if (registrations.isEmpty()) {
            return;
        }
        registrations.forEach((jobId, future) -> future.cancel(false));
        log.info("调度器停止: namespace={}, cancelled={}", settings.namespace(), registrations.size());
        registrations.clear();
    }

    /**
     * 触发回调：投递到 tickExecutor，任何异常都不影响后续触发
     */
    private void dispatch(JobDefinition job) {
        try {
            tickExecutor.execute(() -> {
                try {
                    fire(job);
                } catch (RuntimeException e) {
                    log.error("任务执行异常: jobId={}", job.id(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("任务投递被拒绝，本次跳过: jobId={}", job.id());
        }
    }

    /**
     * 执行一次 tick
     *
     * @param job 任务定义
     * @return tick 结果
     */
    public TickOutcome fire(JobDefinition job) {
        String key = LockKeys.of(settings.namespace(), job.id());
        String token = FencingTokens.next();
        long ttlMillis = job.effectiveDuration(settings.defaultDurationMillis());

        states.put(job.id(), JobTickState.ACQUIRING);
        boolean acquired;
        try {
            acquired = lockClient.acquire(key, token, ttlMillis);
        } catch (RuntimeException e) {
            states.put(job.id(), JobTickState.IDLE);
            log.warn("加锁失败，本次跳过: jobId={}, key={}, error={}", job.id(), key, e.getMessage());
            return TickOutcome.LOCK_ERROR;
        }
        if (!acquired) {
            states.put(job.id(), JobTickState.IDLE);
            log.debug("锁被占用，本次跳过: jobId={}, key={}", job.id(), key);
            return TickOutcome.LOCK_BUSY;
        }

        log.debug("获取锁成功，开始执行: jobId={}, key={}, ttl={}ms", job.id(), key, ttlMillis);
        states.put(job.id(), JobTickState.RUNNING);
        long startTime = System.currentTimeMillis();
        List<ActionResult> results;
        try {
            results = actionRunner.runSeries(job.actions());
        } finally {
            states.put(job.id(), JobTickState.RELEASING);
        }
        long cost = System.currentTimeMillis() - startTime;
        long failed = results.stream().filter(r -> !r.success()).count();
        if (cost > ttlMillis) {
            log.warn("任务执行时间超过锁过期时间，锁可能已在执行中过期: jobId={}, cost={}ms, ttl={}ms",
                    job.id(), cost, ttlMillis);
        }
        log.info("任务执行完成: jobId={}, actions={}, failed={}, cost={}ms", job.id(), results.size(), failed, cost);

        try {
            boolean released = lockClient.release(key, token);
            if (!released) {
                log.warn("释放锁未生效（锁已过期或被其他实例持有）: jobId={}, key={}", job.id(), key);
                return TickOutcome.RELEASE_MISSED;
            }
            return TickOutcome.RELEASED;
        } catch (RuntimeException e) {
            log.warn("释放锁失败，等待锁自然过期: jobId={}, key={}, error={}", job.id(), key, e.getMessage());
            return TickOutcome.RELEASE_ERROR;
        } finally {
            states.put(job.id(), JobTickState.IDLE);
        }
    }

    /**
     * 任务最近一次 tick 状态，未注册的任务返回 IDLE
     * <p>
     * 同一任务存在重叠 tick 时返回最后写入的状态
     */
    public JobTickState getState(String jobId) {
        return states.getOrDefault(jobId, JobTickState.IDLE);
    }

    public Set<String> registeredJobIds() {
        return Set.copyOf(registrations.keySet());
    }

    public SchedulerSettings getSettings() {
        return settings;
    }
}
