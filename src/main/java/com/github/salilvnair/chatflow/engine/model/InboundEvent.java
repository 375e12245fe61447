package com.github.salilvnair.chatflow.engine.model;

import lombok.Builder;

import java.time.Instant;

/**
 * One event from the messaging webhook. {@code messageId} is the gateway's id and is
 * used to recognise redeliveries of the same event.
 */
@Builder
public record InboundEvent(
        String messageId,
        String senderId,
        InboundEventType type,
        String text,
        String mediaRef,
        Instant timestamp
) {

    public String textOrEmpty() {
        return text == null ? "" : text;
    }

    public boolean isMedia() {
        return type != null && type.isMedia();
    }
}
