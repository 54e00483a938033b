package com.sunny.cron.core.scheduler;

/**
 * 单个任务的 tick 状态
 * <p>
 * IDLE -> ACQUIRING -> RUNNING -> RELEASING -> IDLE，加锁失败时 ACQUIRING -> IDLE
 *
 * @author SunnyX6
 * @date 2025-12-14
 */
public enum JobTickState {

    IDLE,

    ACQUIRING,

    RUNNING,

    RELEASING
}
