package com.github.salilvnair.chatflow.engine.exception;

import lombok.Getter;

import java.util.Map;

/**
 * Bad user input. The engine answers with the catalog message {@link #getMessageKey()}
 * followed by the current prompt and leaves the session untouched.
 */
@Getter
public class ValidationException extends ChatFlowException {

    private final String messageKey;
    private final Map<String, Object> messageVars;

    public ValidationException(String messageKey) {
        this(ChatFlowErrorCode.INVALID_INPUT, messageKey, Map.of());
    }

    public ValidationException(ChatFlowErrorCode code, String messageKey, Map<String, Object> messageVars) {
        super(code, code.defaultMessage() + ": " + messageKey);
        this.messageKey = messageKey;
        this.messageVars = messageVars == null ? Map.of() : messageVars;
    }
}
