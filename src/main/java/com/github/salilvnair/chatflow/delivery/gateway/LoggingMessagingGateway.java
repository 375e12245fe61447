package com.github.salilvnair.chatflow.delivery.gateway;

import com.github.salilvnair.chatflow.delivery.OutboundPayload;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

/** Used when no platform credentials are configured. */
@Slf4j
public class LoggingMessagingGateway implements MessagingGateway {

    @Override
    public SendOutcome send(String recipient, OutboundPayload payload) {
        log.info("ChatFlow outbound (not sent) to={} payload={}", recipient, payload.summary());
        return new SendOutcome.Delivered("local-" + UUID.randomUUID());
    }
}
