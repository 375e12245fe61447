package com.github.salilvnair.chatflow.api.dto;

public record ErrorPayload(String errorCode, String message, boolean recoverable) {
}
