package com.trender.pipeline.retry;

/**
 * Blocking pause used by retry backoff and rate-limit waits.
 * Tests substitute a recording implementation so no real time passes.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
