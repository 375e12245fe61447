package com.github.salilvnair.chatflow.engine.exception;

/**
 * Gateway rejected the message for good (invalid recipient, blocked number, bad payload).
 */
public class PermanentDeliveryException extends ChatFlowException {

    public PermanentDeliveryException(String message) {
        super(ChatFlowErrorCode.DELIVERY_PERMANENT_FAILURE, message);
    }

    public PermanentDeliveryException(String message, Throwable cause) {
        super(ChatFlowErrorCode.DELIVERY_PERMANENT_FAILURE, message, cause);
    }
}
