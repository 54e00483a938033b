package com.sunny.cron.core.cron;

import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronUtilsTest {

    @Test
    void toSpringExpression_shouldPrependZeroSeconds() {
        assertEquals("0 */5 * * * *", CronUtils.toSpringExpression("*/5 * * * *"));
        assertEquals("0 30 2 * * MON-FRI", CronUtils.toSpringExpression("  30  2 * * MON-FRI "));
    }

    @Test
    void toSpringExpression_shouldRejectSixFields() {
        assertThrows(IllegalArgumentException.class, () -> CronUtils.toSpringExpression("0 */5 * * * *"));
    }

    @Test
    void isValidCron_shouldCheckFieldValues() {
        assertTrue(CronUtils.isValidCron("0 0 1 * *"));
        assertFalse(CronUtils.isValidCron("61 * * * *"));
        assertFalse(CronUtils.isValidCron("not a cron"));
        assertFalse(CronUtils.isValidCron(null));
    }

    @Test
    void nextTriggerTime_shouldUseMinuteGranularity() {
        ZoneId zone = ZoneId.of("UTC");
        ZonedDateTime from = ZonedDateTime.of(2025, 12, 14, 10, 3, 20, 0, zone);

        ZonedDateTime next = CronUtils.nextTriggerTime("*/5 * * * *", from, zone);

        assertEquals(ZonedDateTime.of(2025, 12, 14, 10, 5, 0, 0, zone), next);
    }
}
