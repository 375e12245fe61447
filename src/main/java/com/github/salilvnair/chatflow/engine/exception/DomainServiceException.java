package com.github.salilvnair.chatflow.engine.exception;

import lombok.Getter;

/**
 * A domain facade (tax computation, parsing, validation, notification) failed.
 * The transition is aborted and the session stays at its pre-transition state.
 */
@Getter
public class DomainServiceException extends ChatFlowException {

    private final String service;

    public DomainServiceException(String service, String message) {
        super(ChatFlowErrorCode.DOMAIN_SERVICE_FAILED, service + ": " + message);
        this.service = service;
    }

    public DomainServiceException(String service, String message, Throwable cause) {
        super(ChatFlowErrorCode.DOMAIN_SERVICE_FAILED, service + ": " + message, cause);
        this.service = service;
    }

    public static DomainServiceException unavailable(String service) {
        return new DomainServiceException(service, ChatFlowErrorCode.SERVICE_UNAVAILABLE.defaultMessage());
    }
}
