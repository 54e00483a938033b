package com.sunny.cron.core.lock;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LockKeysTest {

    @Test
    void of_shouldJoinNamespaceAndJobId() {
        assertEquals("billing:cronjob:cleanup.yml", LockKeys.of("billing", "cleanup.yml"));
    }

    @Test
    void of_shouldRejectBlankNamespace() {
        assertThrows(IllegalArgumentException.class, () -> LockKeys.of(" ", "cleanup.yml"));
    }

    @Test
    void fencingTokens_shouldBeUrlSafeAndUnique() {
        Set<String> tokens = new HashSet<>();
        for (int i = 0; i < 256; i++) {
            String token = FencingTokens.next();
            assertEquals(32, token.length());
            assertTrue(token.matches("^[A-Za-z0-9_-]+$"));
            tokens.add(token);
        }
        assertEquals(256, tokens.size());
    }
}
