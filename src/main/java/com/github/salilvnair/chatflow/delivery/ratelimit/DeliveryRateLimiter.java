package com.github.salilvnair.chatflow.delivery.ratelimit;

import com.github.salilvnair.chatflow.config.ChatFlowDeliveryConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-recipient minute and day buckets plus one global bucket shared by all recipients.
 * A send needs a token from all three; tokens already taken are returned when a later
 * bucket refuses.
 */
public class DeliveryRateLimiter {

    private final int perMinute;
    private final int perDay;
    private final TokenBucket global;
    private final Map<String, List<TokenBucket>> recipients = new ConcurrentHashMap<>();

    public DeliveryRateLimiter(int perMinute, int perDay, int globalPerSecond) {
        this.perMinute = perMinute;
        this.perDay = perDay;
        this.global = new TokenBucket("global/second", globalPerSecond, Duration.ofSeconds(1));
    }

    public static DeliveryRateLimiter from(ChatFlowDeliveryConfig.RateLimit config) {
        return new DeliveryRateLimiter(config.getRecipientPerMinute(), config.getRecipientPerDay(), config.getGlobalPerSecond());
    }

    /**
     * Takes one token from each bucket or none at all. The recipient's buckets are used
     * inside the map's per-key lock, so eviction can never drop them mid-acquisition.
     */
    public RateDecision tryAcquire(String recipient, Instant now) {
        RateDecision[] decision = new RateDecision[1];
        recipients.compute(recipient, (key, existing) -> {
            List<TokenBucket> buckets = existing != null ? existing : List.of(
                    new TokenBucket("recipient/minute", perMinute, Duration.ofMinutes(1)),
                    new TokenBucket("recipient/day", perDay, Duration.ofDays(1))
            );
            decision[0] = acquire(buckets, now);
            return buckets;
        });
        return decision[0];
    }

    /** Drops buckets of recipients with nothing spent in the last day. */
    public int evictIdle(Instant now) {
        int evicted = 0;
        for (String recipient : recipients.keySet()) {
            boolean[] dropped = new boolean[1];
            recipients.computeIfPresent(recipient, (key, buckets) -> {
                dropped[0] = buckets.stream().allMatch(b -> b.isIdle(now));
                return dropped[0] ? null : buckets;
            });
            if (dropped[0]) {
                evicted++;
            }
        }
        return evicted;
    }

    private RateDecision acquire(List<TokenBucket> buckets, Instant now) {
        int taken = 0;
        TokenBucket refused = null;
        for (TokenBucket bucket : buckets) {
            if (!bucket.tryAcquire(now)) {
                refused = bucket;
                break;
            }
            taken++;
        }
        if (refused == null && global.tryAcquire(now)) {
            return RateDecision.allow();
        }
        for (int i = 0; i < taken; i++) {
            buckets.get(i).release();
        }
        return RateDecision.deferred(
                retryAt(buckets, now),
                refused == null ? global.name() : refused.name()
        );
    }

    int trackedRecipients() {
        return recipients.size();
    }

    public TokenBucket global() {
        return global;
    }

    private Instant retryAt(List<TokenBucket> buckets, Instant now) {
        Instant at = global.availableAt(now);
        for (TokenBucket bucket : buckets) {
            Instant candidate = bucket.availableAt(now);
            if (candidate.isAfter(at)) {
                at = candidate;
            }
        }
        return at.isAfter(now) ? at : now.plusMillis(1);
    }
}
