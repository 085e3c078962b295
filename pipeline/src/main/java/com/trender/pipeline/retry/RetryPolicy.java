package com.trender.pipeline.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Predicate;

/**
 * Retry-with-exponential-backoff policy shared by the GitHub client and the
 * connection manager.
 *
 * <p>The delay before attempt {@code n + 1} is {@code baseDelayMs * 2^(n - 1)},
 * capped at {@code maxDelayMs}. A failure that implements {@link DelayHint} with
 * a positive hint (e.g. a {@code Retry-After} header) overrides the computed delay.</p>
 *
 * <p>Non-retryable failures are rethrown immediately; once attempts are
 * exhausted the last failure is rethrown and the caller decides how to degrade.</p>
 */
public final class RetryPolicy {

    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final Predicate<Exception> retryable;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs,
                       Predicate<Exception> retryable, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (baseDelayMs < 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                    "Invalid backoff bounds: base=" + baseDelayMs + ", max=" + maxDelayMs);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.retryable = retryable;
        this.sleeper = sleeper;
    }

    /**
     * Runs {@code call}, retrying retryable failures with exponential backoff.
     *
     * @param operation short description used in log lines
     * @param call      the work to attempt
     * @return the first successful result
     * @throws Exception the non-retryable failure, or the last failure once attempts run out
     */
    public <T> T execute(String operation, RetryableCall<T> call) throws Exception {
        for (int attempt = 1; ; attempt++) {
            try {
                return call.call();
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                if (!retryable.test(e)) {
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    logger.warn("{} failed after {} attempts: {}", operation, attempt, e.getMessage());
                    throw e;
                }
                long waitMs = delayFor(attempt, e);
                logger.warn("{} failed ({}). Retrying in {}ms (attempt {}/{})",
                        operation, e.getMessage(), waitMs, attempt + 1, maxAttempts);
                sleeper.sleep(waitMs);
            }
        }
    }

    /**
     * Backoff delay after the given (1-based) failed attempt.
     */
    long delayFor(int failedAttempt, Exception failure) {
        if (failure instanceof DelayHint hint && hint.delayHintMs() > 0) {
            return Math.min(hint.delayHintMs(), maxDelayMs);
        }
        long delay = baseDelayMs;
        for (int i = 1; i < failedAttempt && delay < maxDelayMs; i++) {
            delay *= 2;
        }
        return Math.min(delay, maxDelayMs);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * A unit of work that may be retried.
     */
    @FunctionalInterface
    public interface RetryableCall<T> {
        T call() throws Exception;
    }

    /**
     * Implemented by failures that carry a server-suggested wait.
     */
    public interface DelayHint {
        long delayHintMs();
    }
}
