package com.github.salilvnair.chatflow.api.dto;

import com.github.salilvnair.chatflow.delivery.dead.DeadLetterEntry;
import lombok.Data;

import java.time.Instant;

@Data
public class DeadLetterResponse {

    private String id;
    private String messageId;
    private String recipient;
    private String payload;
    private String reason;
    private String lastError;
    private int retryCount;
    private String replayOf;
    private Instant enqueuedAt;
    private Instant deadLetteredAt;

    public static DeadLetterResponse from(DeadLetterEntry entry) {
        DeadLetterResponse res = new DeadLetterResponse();
        res.setId(entry.id());
        res.setMessageId(entry.messageId());
        res.setRecipient(entry.recipient());
        res.setPayload(entry.payload().summary());
        res.setReason(entry.reason().name());
        res.setLastError(entry.lastError());
        res.setRetryCount(entry.retryCount());
        res.setReplayOf(entry.replayOf());
        res.setEnqueuedAt(entry.enqueuedAt());
        res.setDeadLetteredAt(entry.deadLetteredAt());
        return res;
    }
}
