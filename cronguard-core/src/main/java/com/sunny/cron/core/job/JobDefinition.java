package com.sunny.cron.core.job;

import com.sunny.cron.core.action.Action;
import com.sunny.cron.core.common.Assert;

import java.util.List;

/**
 * 任务定义（不可变）
 *
 * @param id       任务 ID（任务文件名，全局唯一）
 * @param schedule 5 段 cron 表达式
 * @param duration 锁过期时间（毫秒），为空时使用默认值
 * @param actions  按顺序执行的 Action 列表，可为空列表
 * @param disabled 是否禁用
 * @param env      生效环境，为空表示所有环境
 * @author SunnyX6
 * @date 2025-12-13
 */
public record JobDefinition(String id,
                            String schedule,
                            Long duration,
                            List<Action> actions,
                            boolean disabled,
                            String env) {

    public JobDefinition {
        Assert.notBlank(id, "任务 ID 不能为空");
        Assert.notBlank(schedule, "schedule 不能为空");
        if (duration != null) {
            Assert.positive(duration, "duration 必须大于 0");
        }
        actions = actions == null ? List.of() : List.copyOf(actions);
        env = env == null || env.isBlank() ? null : env.trim();
    }

    /**
     * 实际锁过期时间
     *
     * @param defaultDurationMillis 未配置 duration 时的默认值
     */
    public long effectiveDuration(long defaultDurationMillis) {
        return duration != null ? duration : defaultDurationMillis;
    }

    /**
     * 是否在指定环境下生效，activeEnv 为空时忽略 env 配置
     */
    public boolean matchesEnv(String activeEnv) {
        if (activeEnv == null || activeEnv.isBlank() || env == null) {
            return true;
        }
        return env.equals(activeEnv.trim());
    }
}
