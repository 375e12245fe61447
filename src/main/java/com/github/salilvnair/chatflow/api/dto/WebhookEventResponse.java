package com.github.salilvnair.chatflow.api.dto;

import lombok.Data;

import java.util.List;

@Data
public class WebhookEventResponse {

    private boolean success;
    private String userId;
    private String state;
    private long version;
    private boolean duplicate;
    private List<ApiReply> replies;
    private ErrorPayload error;

    public record ApiReply(String type, String body, String mediaRef) {
    }
}
