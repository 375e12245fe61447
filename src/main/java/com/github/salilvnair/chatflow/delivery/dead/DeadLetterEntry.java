package com.github.salilvnair.chatflow.delivery.dead;

import com.github.salilvnair.chatflow.delivery.OutboundMessage;
import com.github.salilvnair.chatflow.delivery.OutboundPayload;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of a message the pipeline gave up on. Replaying it enqueues a new
 * message; the entry itself is never changed.
 *
 * @param retryCount number of failed send attempts before the message was parked
 */
public record DeadLetterEntry(
        String id,
        String messageId,
        String recipient,
        OutboundPayload payload,
        FailureReason reason,
        String lastError,
        int retryCount,
        String replayOf,
        Instant enqueuedAt,
        Instant deadLetteredAt
) {

    public static DeadLetterEntry of(OutboundMessage message, FailureReason reason, Instant now) {
        return new DeadLetterEntry(
                UUID.randomUUID().toString(),
                message.getId(),
                message.getRecipient(),
                message.getPayload(),
                reason,
                message.getLastError(),
                message.getAttempt(),
                message.getReplayOf(),
                message.getEnqueuedAt(),
                now
        );
    }
}
