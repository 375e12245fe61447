package com.github.salilvnair.chatflow.engine.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * Gateway failure worth retrying: timeouts, 5xx answers and upstream throttling.
 */
@Getter
public class TransientDeliveryException extends ChatFlowException {

    private final Duration retryAfter;

    public TransientDeliveryException(String message) {
        this(message, null, null);
    }

    public TransientDeliveryException(String message, Duration retryAfter, Throwable cause) {
        super(ChatFlowErrorCode.DELIVERY_TRANSIENT_FAILURE, message, cause);
        this.retryAfter = retryAfter;
    }
}
