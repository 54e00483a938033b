package com.sunny.cron.core.scheduler;

import com.sunny.cron.core.common.Assert;
import com.sunny.cron.core.common.Constants;

import java.time.ZoneId;

/**
 * 调度器配置
 *
 * @param namespace             锁 Key 前缀
 * @param defaultDurationMillis 任务未配置 duration 时的锁过期时间
 * @param zone                  cron 计算时区，为空时使用系统时区
 * @author SunnyX6
 * @date 2025-12-14
 */
public record SchedulerSettings(String namespace, long defaultDurationMillis, ZoneId zone) {

    public SchedulerSettings {
        Assert.notBlank(namespace, "namespace 不能为空");
        Assert.positive(defaultDurationMillis, "defaultDurationMillis 必须大于 0");
        namespace = namespace.trim();
        zone = zone == null ? ZoneId.systemDefault() : zone;
    }

    public static SchedulerSettings of(String namespace) {
        return new SchedulerSettings(namespace, Constants.DEFAULT_DURATION_MILLIS, null);
    }
}
