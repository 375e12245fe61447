package com.github.salilvnair.chatflow.delivery.gateway;

import java.time.Duration;

public sealed interface SendOutcome permits SendOutcome.Delivered, SendOutcome.TransientFailure, SendOutcome.PermanentFailure {

    record Delivered(String providerMessageId) implements SendOutcome {
    }

    /**
     * @param retryAfter provider-requested minimum wait, or {@code null}
     */
    record TransientFailure(String reason, Duration retryAfter) implements SendOutcome {
    }

    record PermanentFailure(String reason) implements SendOutcome {
    }
}
