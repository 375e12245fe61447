package com.github.salilvnair.chatflow.delivery.ratelimit;

import java.time.Instant;

/**
 * @param retryAt earliest instant at which every bucket has capacity; {@code null} when granted
 * @param limitedBy name of the first bucket that refused, for logging
 */
public record RateDecision(boolean granted, Instant retryAt, String limitedBy) {

    private static final RateDecision GRANTED = new RateDecision(true, null, null);

    public static RateDecision allow() {
        return GRANTED;
    }

    public static RateDecision deferred(Instant retryAt, String limitedBy) {
        return new RateDecision(false, retryAt, limitedBy);
    }
}
