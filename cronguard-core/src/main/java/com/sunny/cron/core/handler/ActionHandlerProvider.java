package com.sunny.cron.core.handler;

import org.pf4j.ExtensionPoint;

/**
 * Action 提供者 PF4J 扩展点接口
 * <p>
 * 插件 jar 实现此接口并添加 @Extension 注解，
 * 放到 plugins 目录后在启动时自动加载
 *
 * @author SunnyX6
 * @date 2025-12-14
 */
public interface ActionHandlerProvider extends ExtensionPoint {

    /**
     * 注册 Action
     *
     * @param registry Action 注册表
     */
    void registerHandlers(ActionHandlerRegistry registry);
}
