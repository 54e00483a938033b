package com.sunny.cron.core.action;

import com.sunny.cron.core.common.Assert;

import java.util.concurrent.Callable;

/**
 * 进程内调用动作
 *
 * @param name     显示名，为空时使用 "callable"
 * @param callable 无参调用
 * @author SunnyX6
 * @date 2025-12-13
 */
public record CallableAction(String name, Callable<?> callable) implements Action {

    private static final String DEFAULT_NAME = "callable";

    public CallableAction {
        Assert.notNull(callable, "callable 不能为空");
        name = name == null || name.isBlank() ? DEFAULT_NAME : name;
    }

    public static CallableAction of(Callable<?> callable) {
        return new CallableAction(null, callable);
    }

    public static CallableAction of(String name, Runnable runnable) {
        Assert.notNull(runnable, "runnable 不能为空");
        return new CallableAction(name, () -> {
            runnable.run();
            return null;
        });
    }

    @Override
    public String displayName() {
        return name;
    }
}
