package com.github.salilvnair.chatflow.delivery.retry;

import java.time.Duration;

/**
 * {@code base * 2^attempt}, capped at {@code max}. No jitter, so retry instants are
 * computable in tests.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;

    public ExponentialBackoffRetryPolicy(Duration baseDelay, Duration maxDelay) {
        this(baseDelay.toMillis(), maxDelay.toMillis());
    }

    public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    @Override
    public Duration computeDelay(int attempt) {
        if (attempt <= 0) {
            return Duration.ofMillis(baseDelayMs);
        }
        long delay;
        if (attempt >= 62 || (1L << attempt) > maxDelayMs / baseDelayMs) {
            delay = maxDelayMs;
        }
        else {
            delay = Math.min(maxDelayMs, baseDelayMs * (1L << attempt));
        }
        return Duration.ofMillis(delay);
    }
}
