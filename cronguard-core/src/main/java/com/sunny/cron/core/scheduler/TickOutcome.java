package com.sunny.cron.core.scheduler;

/**
 * 一次 tick 的结果
 *
 * @author SunnyX6
 * @date 2025-12-14
 */
public enum TickOutcome {

    /**
     * 锁被其他实例持有，本次跳过
     */
    LOCK_BUSY,

    /**
     * 加锁时存储不可用，按未获取处理
     */
    LOCK_ERROR,

    /**
     * 执行完成并成功释放锁
     */
    RELEASED,

    /**
     * 执行完成但锁已过期或被他人持有，未释放
     */
    RELEASE_MISSED,

    /**
     * 执行完成但释放时存储不可用，锁等待过期
     */
    RELEASE_ERROR
}
