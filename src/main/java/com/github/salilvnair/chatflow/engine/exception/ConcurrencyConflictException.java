package com.github.salilvnair.chatflow.engine.exception;

import lombok.Getter;

@Getter
public class ConcurrencyConflictException extends ChatFlowException {

    private final String userId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(String userId, long expectedVersion, long actualVersion) {
        super(
                ChatFlowErrorCode.SESSION_VERSION_CONFLICT,
                "Session version conflict userId=" + userId + " expected=" + expectedVersion + " actual=" + actualVersion
        );
        this.userId = userId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}
