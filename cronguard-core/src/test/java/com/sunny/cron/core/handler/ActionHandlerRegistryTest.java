package com.sunny.cron.core.handler;

import org.junit.jupiter.api.Test;
import org.pf4j.PluginManager;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ActionHandlerRegistryTest {

    @Test
    void afterSingletonsInstantiated_shouldRegisterAnnotatedMethods() throws Exception {
        try (AnnotationConfigApplicationContext context =
                     new AnnotationConfigApplicationContext(ActionHandlerRegistry.class, SessionActions.class)) {
            ActionHandlerRegistry registry = context.getBean(ActionHandlerRegistry.class);

            assertEquals(Set.of("purgeSessions", "failingAction"), registry.getHandlerNames());
            assertFalse(registry.hasHandler("withParameter"));
            assertEquals("purged", registry.getHandler("purgeSessions").call());
            assertEquals(1, context.getBean(SessionActions.class).purgeCount);
        }
    }

    @Test
    void methodHandler_shouldUnwrapInvocationTargetException() {
        try (AnnotationConfigApplicationContext context =
                     new AnnotationConfigApplicationContext(ActionHandlerRegistry.class, SessionActions.class)) {
            Callable<?> handler = context.getBean(ActionHandlerRegistry.class).getHandler("failingAction");

            IllegalStateException exception = assertThrows(IllegalStateException.class, handler::call);
            assertEquals("index locked", exception.getMessage());
        }
    }

    @Test
    void register_shouldKeepFirstHandlerOnDuplicate() {
        ActionHandlerRegistry registry = new ActionHandlerRegistry();
        Callable<String> first = () -> "first";
        Callable<String> second = () -> "second";

        assertTrue(registry.register("rotate", first));
        assertFalse(registry.register("rotate", second));

        assertSame(first, registry.getHandler("rotate"));
        assertEquals(1, registry.size());
    }

    @Test
    void register_shouldRejectBlankName() {
        ActionHandlerRegistry registry = new ActionHandlerRegistry();

        assertFalse(registry.register(" ", () -> "x"));
        assertNull(registry.getHandler(" "));
        assertFalse(registry.hasHandler(null));
    }

    @Test
    void afterSingletonsInstantiated_shouldLoadPluginProviders() {
        ActionHandlerRegistry registry = new ActionHandlerRegistry();
        PluginManager pluginManager = mock(PluginManager.class);
        ActionHandlerProvider provider = r -> r.register("rebuildIndex", () -> "rebuilt");
        when(pluginManager.getExtensions(ActionHandlerProvider.class)).thenReturn(List.of(provider));
        ReflectionTestUtils.setField(registry, "pluginManager", pluginManager);

        registry.afterSingletonsInstantiated();

        assertTrue(registry.hasHandler("rebuildIndex"));
    }

    static class SessionActions {

        int purgeCount;

        @CronAction("purgeSessions")
        public String purgeSessions() {
            purgeCount++;
            return "purged";
        }

        @CronAction("failingAction")
        public void failingAction() {
            throw new IllegalStateException("index locked");
        }

        @CronAction("withParameter")
        public void withParameter(String ignored) {
        }
    }
}
