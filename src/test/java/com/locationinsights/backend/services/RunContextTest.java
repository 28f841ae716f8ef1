package com.locationinsights.backend.services;

import com.locationinsights.backend.models.WarningCode;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class RunContextTest {

    @Test
    void testDeadlineStopsRunWithSingleWarning() {
        // Given
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        RunContext context = new RunContext(clock, Duration.ofSeconds(30));
        assertFalse(context.shouldStop("tile-0"));

        // When
        clock.now = clock.now.plusSeconds(31);

        // Then
        assertTrue(context.shouldStop("tile-1"));
        assertTrue(context.shouldStop("tile-2"));
        assertEquals(1, context.getWarnings().size());
        assertEquals(WarningCode.RUN_CANCELLED, context.getWarnings().get(0).getCode());
        assertEquals("tile-1", context.getWarnings().get(0).getUnit());
    }

    @Test
    void testQuotaReportedOnce() {
        RunContext context = new RunContext(Clock.systemUTC(), Duration.ofMinutes(5));

        context.quotaExceeded("tile-3/page-1", "OVER_QUERY_LIMIT");
        context.quotaExceeded("tile-4/page-1", "OVER_QUERY_LIMIT");

        assertTrue(context.shouldStop("place-X"));
        assertEquals(1, context.getWarnings().size());
        assertEquals(WarningCode.QUOTA_EXCEEDED, context.getWarnings().get(0).getCode());
    }

    static class MutableClock extends Clock {
        Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
