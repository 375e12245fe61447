package com.github.salilvnair.chatflow.delivery.retry;

import java.time.Duration;

public interface RetryPolicy {

    /**
     * @param attempt number of failed sends so far (at least 1)
     */
    Duration computeDelay(int attempt);
}
