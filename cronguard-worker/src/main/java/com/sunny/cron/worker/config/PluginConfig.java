package com.sunny.cron.worker.config;

import com.sunny.cron.core.handler.ActionHandlerProvider;
import org.pf4j.DefaultPluginManager;
import org.pf4j.JarPluginLoader;
import org.pf4j.ManifestPluginDescriptorFinder;
import org.pf4j.PluginDescriptorFinder;
import org.pf4j.PluginLoader;
import org.pf4j.PluginManager;
import org.pf4j.RuntimeMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Action 插件配置
 * <p>
 * 插件 jar 放在 cronguard.worker.plugins-dir 下，通过 {@link ActionHandlerProvider} 扩展
 * 向 ActionHandlerRegistry 注册 {@code handler: name} 可引用的 Action。
 * 插件必须在任务文件解析之前加载完成，否则引用插件 Action 的任务文件会因 handler 未注册而加载失败
 * <p>
 * pf4j.mode=development 时从 classpath 加载扩展，便于本地调试
 *
 * @author SunnyX6
 * @date 2025-12-14
 */
@Configuration
public class PluginConfig {

    private static final Logger log = LoggerFactory.getLogger(PluginConfig.class);

    @Bean
    public PluginManager pluginManager(CronWorkerProperties properties,
                                       @Value("${pf4j.mode:deployment}") String mode) {
        Path pluginsPath = resolvePluginsPath(properties.getPluginsDir());
        RuntimeMode runtimeMode = RuntimeMode.byName(mode);

        PluginManager pluginManager = new DefaultPluginManager(pluginsPath) {
            @Override
            public RuntimeMode getRuntimeMode() {
                return runtimeMode;
            }

            @Override
            protected PluginLoader createPluginLoader() {
                return new JarPluginLoader(this);
            }

            @Override
            protected PluginDescriptorFinder createPluginDescriptorFinder() {
                return new ManifestPluginDescriptorFinder();
            }
        };

        pluginManager.loadPlugins();
        pluginManager.startPlugins();

        int providers = pluginManager.getExtensions(ActionHandlerProvider.class).size();
        log.info("Action 插件加载完成: mode={}, dir={}, plugins={}, providers={}",
                runtimeMode, pluginsPath, pluginManager.getPlugins().size(), providers);
        return pluginManager;
    }

    /**
     * 相对路径按工作目录解析，未配置时使用 plugins
     */
    static Path resolvePluginsPath(String pluginsDir) {
        String dir = pluginsDir == null || pluginsDir.isBlank() ? "plugins" : pluginsDir.trim();
        return Paths.get(dir).toAbsolutePath().normalize();
    }
}
