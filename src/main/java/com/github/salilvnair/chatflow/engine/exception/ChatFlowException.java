package com.github.salilvnair.chatflow.engine.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class ChatFlowException extends RuntimeException {

    private final String errorCode;
    private final boolean recoverable;
    private Map<String, Object> metaData;

    public ChatFlowException(ChatFlowErrorCode code) {
        super(code.defaultMessage());
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public ChatFlowException(ChatFlowErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public ChatFlowException(ChatFlowErrorCode code, String overrideMessage, Throwable cause) {
        super(overrideMessage, cause);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public ChatFlowException withMetaData(Map<String, Object> metaData) {
        this.metaData = metaData;
        return this;
    }
}
