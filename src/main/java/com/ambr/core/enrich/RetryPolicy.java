package com.ambr.core.enrich;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded retries with a fixed pause between attempts.
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration delay;

    public RetryPolicy(int maxAttempts, Duration delay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative: " + delay);
        }
        this.maxAttempts = maxAttempts;
        this.delay = delay;
    }

    /**
     * Default: 3 attempts, 2s apart.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(3, Duration.ofSeconds(2));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getDelay() {
        return delay;
    }

    /**
     * @param attempt one-based number of the attempt that just failed
     */
    public boolean shouldRetry(int attempt) {
        return attempt < maxAttempts;
    }

    public void pause() throws InterruptedException {
        if (!delay.isZero()) {
            Thread.sleep(delay.toMillis());
        }
    }
}
