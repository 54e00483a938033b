package com.sunny.cron.core.handler;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.concurrent.Callable;

/**
 * 方法级 Action
 * <p>
 * 封装 @CronAction 标注的无参方法，返回值作为 Action 输出
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public class MethodActionHandler implements Callable<Object> {

    private final Object target;
    private final Method method;

    public MethodActionHandler(Object target, Method method) {
        this.target = target;
        this.method = method;
        this.method.setAccessible(true);
    }

    @Override
    public Object call() throws Exception {
        try {
            return method.invoke(target);
        } catch (InvocationTargetException e) {
            // 解包反射异常，抛出原始异常
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException(cause);
        }
    }

    public String getDescription() {
        return target.getClass().getSimpleName() + "." + method.getName();
    }

    @Override
    public String toString() {
        return getDescription();
    }
}
