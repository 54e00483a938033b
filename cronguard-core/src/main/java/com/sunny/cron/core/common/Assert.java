package com.sunny.cron.core.common;

/**
 * 断言工具类
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public final class Assert {

    private Assert() {
    }

    /**
     * 断言对象不为 null
     */
    public static <T> T notNull(T object, String message) {
        if (object == null) {
            throw new IllegalArgumentException(message);
        }
        return object;
    }

    /**
     * 断言字符串不为空白
     */
    public static String notBlank(String text, String message) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return text;
    }

    /**
     * 断言数值大于 0
     */
    public static long positive(long value, String message) {
        if (value <= 0) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * 断言数值大于等于 0
     */
    public static long notNegative(long value, String message) {
        if (value < 0) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }
}
