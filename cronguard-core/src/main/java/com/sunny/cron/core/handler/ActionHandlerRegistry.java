package com.sunny.cron.core.handler;

import org.pf4j.PluginManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.core.MethodIntrospector;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Action 注册表
 * <p>
 * 任务文件中 {@code handler: name} 形式的 Action 通过本注册表解析，支持两种注册方式：
 * 1. Spring 扫描：自动发现带 @CronAction 注解的 Bean 方法
 * 2. PF4J 插件：通过 PluginManager 加载 ActionHandlerProvider 扩展
 * <p>
 * 名称重复时保留先注册的处理器
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
@Component
public class ActionHandlerRegistry implements ApplicationContextAware, SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(ActionHandlerRegistry.class);

    private ApplicationContext applicationContext;

    /**
     * PF4J 插件管理器（可选注入，由 worker 模块提供）
     */
    @Autowired(required = false)
    private PluginManager pluginManager;

    /**
     * handler 名称 -> 可调用对象
     */
    private final ConcurrentHashMap<String, Callable<?>> handlerMap = new ConcurrentHashMap<>();

    @Override
    public void setApplicationContext(ApplicationContext applicationContext) throws BeansException {
        this.applicationContext = applicationContext;
    }

    @Override
    public void afterSingletonsInstantiated() {
        // 1. Spring 扫描
        scanActionHandlers();
        // 2. PF4J 插件加载
        loadFromPlugins();
    }

    private void loadFromPlugins() {
        if (pluginManager == null) {
            log.info("PluginManager 未配置，跳过插件加载");
            return;
        }

        List<ActionHandlerProvider> providers = pluginManager.getExtensions(ActionHandlerProvider.class);
        for (ActionHandlerProvider provider : providers) {
            log.info("发现 ActionHandlerProvider 扩展: {}", provider.getClass().getName());
            provider.registerHandlers(this);
        }

        log.info("PF4J 插件加载完成，共发现 {} 个 Provider", providers.size());
    }

    private void scanActionHandlers() {
        if (applicationContext == null) {
            return;
        }
        log.info("开始扫描 @CronAction 注解的方法...");

        String[] beanNames = applicationContext.getBeanNamesForType(Object.class, false, true);
        for (String beanName : beanNames) {
            Object bean = applicationContext.getBean(beanName);

            Map<Method, CronAction> annotatedMethods;
            try {
                annotatedMethods = MethodIntrospector.selectMethods(
                        bean.getClass(),
                        (MethodIntrospector.MetadataLookup<CronAction>) method ->
                                AnnotatedElementUtils.findMergedAnnotation(method, CronAction.class)
                );
            } catch (Throwable ex) {
                log.debug("扫描 Bean [{}] 失败: {}", beanName, ex.getMessage());
                continue;
            }

            for (Map.Entry<Method, CronAction> entry : annotatedMethods.entrySet()) {
                registerMethod(bean, entry.getKey(), entry.getValue());
            }
        }

        log.info("@CronAction 扫描完成，共注册 {} 个处理器", handlerMap.size());
    }

    private void registerMethod(Object bean, Method method, CronAction annotation) {
        String handlerName = annotation.value();
        if (handlerName.isBlank()) {
            log.warn("@CronAction value 为空，忽略: {}.{}", bean.getClass().getName(), method.getName());
            return;
        }
        if (method.getParameterCount() > 0) {
            log.warn("@CronAction 方法必须无参，忽略: {}.{}", bean.getClass().getName(), method.getName());
            return;
        }
        register(handlerName, new MethodActionHandler(bean, method));
    }

    /**
     * 注册处理器（供 Provider 及测试使用）
     *
     * @param handlerName 处理器名称
     * @param handler     可调用对象
     * @return true 注册成功，false 名称为空或重复
     */
    public boolean register(String handlerName, Callable<?> handler) {
        if (handlerName == null || handlerName.isBlank() || handler == null) {
            log.warn("Handler 名称或实例为空，忽略");
            return false;
        }
        Callable<?> existing = handlerMap.putIfAbsent(handlerName, handler);
        if (existing != null) {
            log.error("Handler 名称重复: {}, 已存在于 {}", handlerName, existing);
            return false;
        }
        log.info("注册 ActionHandler: {} -> {}", handlerName, handler);
        return true;
    }

    /**
     * 获取处理器
     *
     * @return 处理器实例，不存在返回 null
     */
    public Callable<?> getHandler(String handlerName) {
        return handlerName == null ? null : handlerMap.get(handlerName);
    }

    public boolean hasHandler(String handlerName) {
        return handlerName != null && handlerMap.containsKey(handlerName);
    }

    public Set<String> getHandlerNames() {
        return Set.copyOf(handlerMap.keySet());
    }

    public int size() {
        return handlerMap.size();
    }
}
