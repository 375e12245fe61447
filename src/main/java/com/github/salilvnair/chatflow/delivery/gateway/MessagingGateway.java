package com.github.salilvnair.chatflow.delivery.gateway;

import com.github.salilvnair.chatflow.delivery.OutboundPayload;

/**
 * Single send to the messaging platform. Implementations either return an outcome or throw
 * {@link com.github.salilvnair.chatflow.engine.exception.TransientDeliveryException} /
 * {@link com.github.salilvnair.chatflow.engine.exception.PermanentDeliveryException};
 * any other runtime exception is treated as transient.
 */
public interface MessagingGateway {

    SendOutcome send(String recipient, OutboundPayload payload);
}
