package com.github.salilvnair.chatflow.delivery.dead;

/**
 * Optional narrowing of a dead-letter listing; {@code null} fields match everything.
 */
public record DeadLetterFilter(String recipient, FailureReason reason, int limit) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    public DeadLetterFilter {
        if (recipient != null && recipient.isBlank()) {
            recipient = null;
        }
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
        limit = Math.min(limit, MAX_LIMIT);
    }

    public static DeadLetterFilter all() {
        return new DeadLetterFilter(null, null, DEFAULT_LIMIT);
    }

    public boolean matches(DeadLetterEntry entry) {
        return (recipient == null || recipient.equals(entry.recipient()))
                && (reason == null || reason == entry.reason());
    }
}
