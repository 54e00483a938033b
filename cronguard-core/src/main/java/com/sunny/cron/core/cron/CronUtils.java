package com.sunny.cron.core.cron;

import com.sunny.cron.core.common.Assert;
import org.springframework.scheduling.support.CronExpression;

import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Cron 工具类
 * <p>
 * 任务文件使用标准 5 段 cron（分 时 日 月 周），
 * Spring CronExpression 需要 6 段（秒 分 时 日 月 周），转换时秒固定为 0
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public final class CronUtils {

    private static final int STANDARD_FIELD_COUNT = 5;

    private CronUtils() {
    }

    /**
     * 将 5 段 cron 转换为 Spring 6 段表达式
     *
     * @param schedule 5 段 cron 表达式
     * @return 6 段表达式
     * @throws IllegalArgumentException 表达式为空或段数不为 5
     */
    public static String toSpringExpression(String schedule) {
        Assert.notBlank(schedule, "Cron 表达式不能为空");
        String[] fields = schedule.trim().split("\\s+");
        if (fields.length != STANDARD_FIELD_COUNT) {
            throw new IllegalArgumentException(
                    "Cron 表达式必须为 5 段（分 时 日 月 周），实际 " + fields.length + " 段: " + schedule);
        }
        return "0 " + String.join(" ", fields);
    }

    /**
     * 解析 5 段 cron 表达式
     *
     * @throws IllegalArgumentException 表达式无效
     */
    public static CronExpression parse(String schedule) {
        return CronExpression.parse(toSpringExpression(schedule));
    }

    /**
     * 验证 5 段 Cron 表达式是否有效
     *
     * @param schedule Cron 表达式
     * @return true 有效，false 无效
     */
    public static boolean isValidCron(String schedule) {
        if (schedule == null || schedule.isBlank()) {
            return false;
        }
        try {
            parse(schedule);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * 计算下一次触发时间
     *
     * @param schedule 5 段 cron 表达式
     * @param from     起始时间
     * @param zoneId   时区
     * @return 下一次触发时间，无法计算时返回 null
     */
    public static ZonedDateTime nextTriggerTime(String schedule, ZonedDateTime from, ZoneId zoneId) {
        return parse(schedule).next(from.withZoneSameInstant(zoneId));
    }
}
