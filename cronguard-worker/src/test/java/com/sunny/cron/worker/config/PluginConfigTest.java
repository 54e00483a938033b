package com.sunny.cron.worker.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pf4j.PluginManager;
import org.pf4j.RuntimeMode;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginConfigTest {

    @TempDir
    Path pluginsDir;

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(PluginConfig.class)
            .withBean(CronWorkerProperties.class, () -> {
                CronWorkerProperties properties = new CronWorkerProperties();
                properties.setPluginsDir(pluginsDir.toString());
                return properties;
            });

    @Test
    @SuppressWarnings("deprecation")
    void pluginManager_shouldUsePluginsDirFromWorkerProperties() {
        contextRunner.run(context -> {
            PluginManager pluginManager = context.getBean(PluginManager.class);

            assertEquals(pluginsDir.toAbsolutePath().normalize(), pluginManager.getPluginsRoot());
            assertEquals(RuntimeMode.DEPLOYMENT, pluginManager.getRuntimeMode());
            assertTrue(pluginManager.getPlugins().isEmpty());
        });
    }

    @Test
    void pluginManager_shouldHonorDevelopmentMode() {
        contextRunner
                .withPropertyValues("pf4j.mode=development")
                .run(context -> assertEquals(RuntimeMode.DEVELOPMENT,
                        context.getBean(PluginManager.class).getRuntimeMode()));
    }

    @Test
    void resolvePluginsPath_shouldDefaultToPlugins() {
        assertEquals(Paths.get("plugins").toAbsolutePath().normalize(), PluginConfig.resolvePluginsPath(" "));
        assertEquals(Paths.get("plugins").toAbsolutePath().normalize(), PluginConfig.resolvePluginsPath(null));
    }
}
