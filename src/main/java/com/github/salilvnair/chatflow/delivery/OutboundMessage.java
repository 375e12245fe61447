package com.github.salilvnair.chatflow.delivery;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A message owned by the delivery pipeline. Mutated only by the worker that
 * currently holds it.
 */
@Getter
@Setter
public class OutboundMessage {

    private final String id;
    private final String recipient;
    private final OutboundPayload payload;
    private final Instant enqueuedAt;
    private final String replayOf;
    private long sequence;
    private int attempt;
    private Instant nextAttemptAt;
    private volatile MessageStatus status;
    private String lastError;

    public OutboundMessage(String id, String recipient, OutboundPayload payload, Instant enqueuedAt, String replayOf) {
        this.id = Objects.requireNonNull(id, "id");
        this.recipient = Objects.requireNonNull(recipient, "recipient");
        this.payload = Objects.requireNonNull(payload, "payload");
        this.enqueuedAt = Objects.requireNonNull(enqueuedAt, "enqueuedAt");
        this.replayOf = replayOf;
        this.attempt = 0;
        this.nextAttemptAt = enqueuedAt;
        this.status = MessageStatus.QUEUED;
    }

    public static OutboundMessage create(String recipient, OutboundPayload payload, Instant now) {
        return new OutboundMessage(UUID.randomUUID().toString(), recipient, payload, now, null);
    }

    public static OutboundMessage replayOf(String deadLetterId, String recipient, OutboundPayload payload, Instant now) {
        return new OutboundMessage(UUID.randomUUID().toString(), recipient, payload, now, deadLetterId);
    }

    @Override
    public String toString() {
        return "OutboundMessage{id=" + id + ", recipient=" + recipient + ", attempt=" + attempt + ", status=" + status + "}";
    }
}
