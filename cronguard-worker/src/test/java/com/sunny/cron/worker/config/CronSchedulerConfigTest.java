package com.sunny.cron.worker.config;

import com.sunny.cron.core.exception.ConfigurationException;
import com.sunny.cron.core.handler.ActionHandlerRegistry;
import com.sunny.cron.core.lock.InMemoryLockClient;
import com.sunny.cron.core.lock.LockClient;
import com.sunny.cron.core.scheduler.SchedulerSettings;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronSchedulerConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(CronSchedulerConfig.class)
            .withBean(ActionHandlerRegistry.class);

    @Test
    void memoryLockStore_shouldUseInMemoryClient() {
        contextRunner
                .withPropertyValues(
                        "cronguard.worker.namespace=billing",
                        "cronguard.worker.lock-store=memory",
                        "cronguard.worker.default-duration-ms=5000",
                        "cronguard.worker.zone=Asia/Shanghai",
                        "cronguard.worker.executor.core-size=2",
                        "cronguard.worker.executor.max-size=3")
                .run(context -> {
                    assertInstanceOf(InMemoryLockClient.class, context.getBean(LockClient.class));

                    SchedulerSettings settings = context.getBean(SchedulerSettings.class);
                    assertEquals("billing", settings.namespace());
                    assertEquals(5000L, settings.defaultDurationMillis());
                    assertEquals(ZoneId.of("Asia/Shanghai"), settings.zone());

                    ThreadPoolTaskExecutor executor = context.getBean("cronTickExecutor", ThreadPoolTaskExecutor.class);
                    assertEquals(2, executor.getCorePoolSize());
                    assertEquals(3, executor.getMaxPoolSize());
                });
    }

    @Test
    void redisLockStore_shouldFailWithoutRedisTemplate() {
        contextRunner
                .withPropertyValues("cronguard.worker.namespace=billing")
                .run(context -> {
                    assertTrue(context.getStartupFailure() != null);
                    assertTrue(hasCause(context.getStartupFailure(), ConfigurationException.class));
                });
    }

    @Test
    void blankNamespace_shouldFailStartup() {
        contextRunner
                .withPropertyValues("cronguard.worker.lock-store=memory")
                .run(context -> assertTrue(hasCause(context.getStartupFailure(), ConfigurationException.class)));
    }

    private static boolean hasCause(Throwable failure, Class<? extends Throwable> type) {
        for (Throwable current = failure; current != null; current = current.getCause()) {
            if (type.isInstance(current)) {
                return true;
            }
        }
        return false;
    }
}
