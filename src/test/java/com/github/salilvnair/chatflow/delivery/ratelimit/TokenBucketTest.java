package com.github.salilvnair.chatflow.delivery.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.github.salilvnair.chatflow.support.TestConstants.T0;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenBucketTest {

    private final TokenBucket bucket = new TokenBucket("test", 3, Duration.ofMinutes(1));

    @Test
    void refusesOnceCapacityIsSpent() {
        assertTrue(bucket.tryAcquire(T0));
        assertTrue(bucket.tryAcquire(T0.plusSeconds(1)));
        assertTrue(bucket.tryAcquire(T0.plusSeconds(2)));

        assertFalse(bucket.tryAcquire(T0.plusSeconds(3)));
        assertEquals(0, bucket.available(T0.plusSeconds(3)));
    }

    @Test
    void tokensComeBackAsTheWindowSlides() {
        bucket.tryAcquire(T0);
        bucket.tryAcquire(T0.plusSeconds(10));
        bucket.tryAcquire(T0.plusSeconds(20));

        assertEquals(T0.plusSeconds(60), bucket.availableAt(T0.plusSeconds(30)));
        assertFalse(bucket.tryAcquire(T0.plusSeconds(59)));
        assertTrue(bucket.tryAcquire(T0.plusSeconds(60)));
        assertEquals(T0.plusSeconds(70), bucket.availableAt(T0.plusSeconds(60)));
    }

    @Test
    void releaseRefundsLastToken() {
        bucket.tryAcquire(T0);
        bucket.tryAcquire(T0);
        bucket.tryAcquire(T0);

        bucket.release();

        assertEquals(1, bucket.available(T0));
        assertEquals(T0, bucket.availableAt(T0));
    }

    @Test
    void idleWhenNothingSpentInWindow() {
        assertTrue(bucket.isIdle(T0));
        bucket.tryAcquire(T0);
        assertFalse(bucket.isIdle(T0.plusSeconds(59)));
        assertTrue(bucket.isIdle(T0.plusSeconds(60)));
    }

    @Test
    void rejectsInvalidShape() {
        assertThrows(IllegalArgumentException.class, () -> new TokenBucket("x", 0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new TokenBucket("x", 1, Duration.ZERO));
    }
}
