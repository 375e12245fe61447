package com.github.salilvnair.chatflow.delivery.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Token bucket with sliding refill: each spent token comes back exactly one
 * {@code window} after it was taken. No window-length interval, wherever it starts, ever
 * sees more than {@code capacity} acquisitions.
 */
public final class TokenBucket {

    private final String name;
    private final int capacity;
    private final Duration window;
    private final Deque<Instant> spent;

    public TokenBucket(String name, int capacity, Duration window) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive, got: " + window);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.capacity = capacity;
        this.window = window;
        this.spent = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /** Takes one token if available. Check and decrement happen atomically. */
    public synchronized boolean tryAcquire(Instant now) {
        refill(now);
        if (spent.size() >= capacity) {
            return false;
        }
        spent.addLast(now);
        return true;
    }

    /** Returns the most recently taken token, for callers that could not use it. */
    public synchronized void release() {
        spent.pollLast();
    }

    /** Earliest instant at which a token will be available. */
    public synchronized Instant availableAt(Instant now) {
        refill(now);
        if (spent.size() < capacity) {
            return now;
        }
        return spent.peekFirst().plus(window);
    }

    public synchronized int available(Instant now) {
        refill(now);
        return capacity - spent.size();
    }

    public synchronized boolean isIdle(Instant now) {
        refill(now);
        return spent.isEmpty();
    }

    public String name() {
        return name;
    }

    public int capacity() {
        return capacity;
    }

    public Duration window() {
        return window;
    }

    private void refill(Instant now) {
        while (!spent.isEmpty() && !spent.peekFirst().plus(window).isAfter(now)) {
            spent.pollFirst();
        }
    }
}
