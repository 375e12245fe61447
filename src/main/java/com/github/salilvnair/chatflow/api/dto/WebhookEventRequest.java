package com.github.salilvnair.chatflow.api.dto;

import lombok.Data;

import java.time.Instant;

@Data
public class WebhookEventRequest {

    private String messageId;
    private String senderId;
    /** TEXT, IMAGE, DOCUMENT or INTERACTIVE_REPLY; defaults to TEXT */
    private String type;
    private String text;
    private String mediaRef;
    private Instant timestamp;
}
