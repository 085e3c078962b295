package com.trender.pipeline.client;

import okhttp3.Headers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link RateLimitTracker} quota gating.
 */
class RateLimitTrackerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private final List<Long> sleeps = new ArrayList<>();
    private final RateLimitTracker tracker =
            new RateLimitTracker(Clock.fixed(NOW, ZoneOffset.UTC), sleeps::add);

    @Test
    @DisplayName("Low quota pauses until the reset time plus the safety margin")
    void lowQuotaPausesUntilReset() throws Exception {
        long reset = NOW.getEpochSecond() + 10;
        tracker.afterResponse(Headers.of("X-RateLimit-Remaining", "50", "X-RateLimit-Reset", String.valueOf(reset)));

        tracker.beforeRequest();

        assertEquals(1, sleeps.size());
        assertTrue(sleeps.get(0) >= 15_000, "Expected at least 15s pause, got " + sleeps.get(0));
    }

    @Test
    @DisplayName("No pause while the quota is above the low-water mark")
    void healthyQuotaDoesNotPause() throws Exception {
        tracker.update("4500", String.valueOf(NOW.getEpochSecond() + 3600));

        tracker.beforeRequest();

        assertTrue(sleeps.isEmpty());
        assertEquals(4500, tracker.remaining());
    }

    @Test
    @DisplayName("No pause once the reset time has passed")
    void resetInThePastDoesNotPause() throws Exception {
        tracker.update("3", String.valueOf(NOW.getEpochSecond() - 1));

        tracker.beforeRequest();

        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Missing or unparseable headers leave the last known quota unchanged")
    void badHeadersIgnored() {
        tracker.update("120", "1700000000");

        tracker.afterResponse(Headers.of());
        tracker.update("many", "soon");

        assertEquals(120, tracker.remaining());
        assertEquals(1700000000L, tracker.resetEpochSeconds());
    }
}
