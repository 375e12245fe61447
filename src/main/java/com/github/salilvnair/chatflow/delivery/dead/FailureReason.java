package com.github.salilvnair.chatflow.delivery.dead;

public enum FailureReason {
    MAX_RETRIES_EXCEEDED,
    PERMANENT_FAILURE,
    QUEUE_FULL,
    /** Still queued when the pipeline shut down. */
    SHUTDOWN
}
