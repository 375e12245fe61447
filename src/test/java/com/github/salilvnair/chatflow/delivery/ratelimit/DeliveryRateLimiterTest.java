package com.github.salilvnair.chatflow.delivery.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static com.github.salilvnair.chatflow.support.TestConstants.OTHER_USER_ID;
import static com.github.salilvnair.chatflow.support.TestConstants.T0;
import static com.github.salilvnair.chatflow.support.TestConstants.USER_ID;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeliveryRateLimiterTest {

    @Test
    void perRecipientMinuteCapDefersToWindowEnd() {
        DeliveryRateLimiter limiter = new DeliveryRateLimiter(2, 100, 100);
        assertTrue(limiter.tryAcquire(USER_ID, T0).granted());
        assertTrue(limiter.tryAcquire(USER_ID, T0.plusSeconds(5)).granted());

        RateDecision decision = limiter.tryAcquire(USER_ID, T0.plusSeconds(10));

        assertFalse(decision.granted());
        assertEquals("recipient/minute", decision.limitedBy());
        assertEquals(T0.plusSeconds(60), decision.retryAt());
        assertTrue(limiter.tryAcquire(OTHER_USER_ID, T0.plusSeconds(10)).granted());
    }

    @Test
    void globalRefusalRefundsRecipientTokens() {
        DeliveryRateLimiter limiter = new DeliveryRateLimiter(2, 100, 1);
        assertTrue(limiter.tryAcquire(OTHER_USER_ID, T0).granted());

        RateDecision decision = limiter.tryAcquire(USER_ID, T0);

        assertFalse(decision.granted());
        assertEquals("global/second", decision.limitedBy());
        assertEquals(T0.plusSeconds(1), decision.retryAt());
        // both minute tokens are still there for the user
        Instant next = T0.plusSeconds(1);
        assertTrue(limiter.tryAcquire(USER_ID, next).granted());
        assertTrue(limiter.tryAcquire(USER_ID, next.plusSeconds(1)).granted());
    }

    @Test
    void dailyCapAppliesAcrossMinutes() {
        DeliveryRateLimiter limiter = new DeliveryRateLimiter(10, 2, 10);
        assertTrue(limiter.tryAcquire(USER_ID, T0).granted());
        assertTrue(limiter.tryAcquire(USER_ID, T0.plusSeconds(120)).granted());

        RateDecision decision = limiter.tryAcquire(USER_ID, T0.plusSeconds(240));

        assertFalse(decision.granted());
        assertEquals("recipient/day", decision.limitedBy());
        assertEquals(T0.plusSeconds(86_400), decision.retryAt());
    }

    @Test
    void idleRecipientsAreEvicted() {
        DeliveryRateLimiter limiter = new DeliveryRateLimiter(10, 10, 10);
        limiter.tryAcquire(USER_ID, T0);

        assertEquals(0, limiter.evictIdle(T0.plusSeconds(3600)));
        assertEquals(1, limiter.evictIdle(T0.plusSeconds(86_400)));
    }

    @Test
    void evictionRacingAcquisitionNeverExceedsCapacity() throws Exception {
        DeliveryRateLimiter limiter = new DeliveryRateLimiter(5, 1000, 1_000_000);
        AtomicBoolean evicting = new AtomicBoolean(true);
        Thread evictor = new Thread(() -> {
            while (evicting.get()) {
                limiter.evictIdle(T0);
            }
        });
        evictor.start();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            for (int r = 0; r < 200; r++) {
                String recipient = "rcpt-" + r;
                AtomicInteger granted = new AtomicInteger();
                List<Future<?>> senders = new ArrayList<>();
                for (int t = 0; t < 4; t++) {
                    senders.add(pool.submit(() -> {
                        for (int i = 0; i < 5; i++) {
                            if (limiter.tryAcquire(recipient, T0).granted()) {
                                granted.incrementAndGet();
                            }
                        }
                    }));
                }
                for (Future<?> sender : senders) {
                    sender.get(5, TimeUnit.SECONDS);
                }
                assertEquals(5, granted.get(), recipient);
            }
        }
        finally {
            evicting.set(false);
            evictor.join();
            pool.shutdownNow();
        }
        assertEquals(200, limiter.trackedRecipients());
    }
}
