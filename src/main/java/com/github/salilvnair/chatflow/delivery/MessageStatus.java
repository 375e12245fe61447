package com.github.salilvnair.chatflow.delivery;

public enum MessageStatus {
    QUEUED,
    SENDING,
    DELIVERED,
    RETRY_SCHEDULED,
    DEAD_LETTERED
}
