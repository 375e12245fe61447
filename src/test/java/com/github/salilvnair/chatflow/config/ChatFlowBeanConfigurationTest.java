package com.github.salilvnair.chatflow.config;

import com.github.salilvnair.chatflow.delivery.OutboundPayload;
import com.github.salilvnair.chatflow.delivery.gateway.CloudApiMessagingGateway;
import com.github.salilvnair.chatflow.delivery.gateway.LoggingMessagingGateway;
import com.github.salilvnair.chatflow.delivery.retry.RetryPolicy;
import com.github.salilvnair.chatflow.domain.DocumentParser;
import com.github.salilvnair.chatflow.engine.exception.DomainServiceException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.github.salilvnair.chatflow.support.TestConstants.MEDIA_REF;
import static com.github.salilvnair.chatflow.support.TestConstants.USER_ID;
import static com.github.salilvnair.chatflow.support.TestConstants.VALID_GSTIN;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChatFlowBeanConfigurationTest {

    private final ChatFlowBeanConfiguration configuration = new ChatFlowBeanConfiguration();

    @Test
    void gatewayIsOnlyLoggedUnlessEnabled() {
        ChatFlowGatewayConfig gateway = new ChatFlowGatewayConfig();
        assertInstanceOf(LoggingMessagingGateway.class, configuration.messagingGateway(gateway));

        gateway.setEnabled(true);
        gateway.setPhoneNumberId("12345");
        gateway.setAccessToken("token");
        assertInstanceOf(CloudApiMessagingGateway.class, configuration.messagingGateway(gateway));
    }

    @Test
    void retryPolicyUsesConfiguredBackoff() {
        ChatFlowDeliveryConfig delivery = new ChatFlowDeliveryConfig();
        delivery.getRetry().setBackoffBase(Duration.ofSeconds(2));
        delivery.getRetry().setBackoffMax(Duration.ofSeconds(10));

        RetryPolicy policy = configuration.deliveryRetryPolicy(delivery);

        assertEquals(Duration.ofSeconds(4), policy.computeDelay(1));
        assertEquals(Duration.ofSeconds(10), policy.computeDelay(5));
    }

    @Test
    void defaultDocumentParserIsUnavailable() {
        DocumentParser parser = configuration.documentParser();

        assertThrows(DomainServiceException.class, () -> parser.parse(USER_ID, MEDIA_REF, OutboundPayload.MediaKind.IMAGE));
    }

    @Test
    void defaultValidatorChecksGstin() {
        assertTrue(configuration.identifierValidator().isValidGstin(VALID_GSTIN));
    }
}
