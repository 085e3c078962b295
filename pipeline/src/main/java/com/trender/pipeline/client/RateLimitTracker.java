package com.trender.pipeline.client;

import com.trender.pipeline.retry.Sleeper;
import okhttp3.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Client-owned view of the GitHub rate-limit quota.
 *
 * <p>Every concurrent analysis task goes through the same tracker. Updates are
 * applied under the tracker's lock so the remaining/reset pair always comes from a
 * single response; last write wins, since GitHub's own counter is authoritative.</p>
 */
public class RateLimitTracker {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitTracker.class);

    static final int LOW_WATER_MARK = 100;
    static final Duration SAFETY_MARGIN = Duration.ofSeconds(5);
    private static final int DEFAULT_QUOTA = 5000;

    private final Clock clock;
    private final Sleeper sleeper;

    private int remaining = DEFAULT_QUOTA;
    private long resetEpochSeconds;

    public RateLimitTracker() {
        this(Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public RateLimitTracker(Clock clock, Sleeper sleeper) {
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until the quota resets (plus a safety margin) when fewer than
     * {@value #LOW_WATER_MARK} calls remain. Returns immediately once the reset time has passed.
     */
    public void beforeRequest() throws InterruptedException {
        long waitMs;
        int remainingNow;
        synchronized (this) {
            long resetMs = resetEpochSeconds * 1_000;
            long nowMs = clock.millis();
            if (remaining >= LOW_WATER_MARK || resetMs <= nowMs) {
                return;
            }
            remainingNow = remaining;
            waitMs = resetMs - nowMs + SAFETY_MARGIN.toMillis();
        }
        logger.warn("Rate limit low ({} remaining). Pausing for {}s until reset.",
                remainingNow, waitMs / 1_000);
        sleeper.sleep(waitMs);
    }

    /**
     * Refreshes the quota from {@code X-RateLimit-Remaining} / {@code X-RateLimit-Reset}.
     */
    public void afterResponse(Headers headers) {
        update(headers.get("X-RateLimit-Remaining"), headers.get("X-RateLimit-Reset"));
    }

    synchronized void update(String remainingHeader, String resetHeader) {
        if (remainingHeader == null || resetHeader == null) {
            return;
        }
        try {
            int newRemaining = Integer.parseInt(remainingHeader.trim());
            long newReset = Long.parseLong(resetHeader.trim());
            remaining = newRemaining;
            resetEpochSeconds = newReset;
        } catch (NumberFormatException e) {
            logger.debug("Ignoring unparseable rate-limit headers: remaining={}, reset={}",
                    remainingHeader, resetHeader);
        }
    }

    public synchronized int remaining() {
        return remaining;
    }

    public synchronized long resetEpochSeconds() {
        return resetEpochSeconds;
    }
}
