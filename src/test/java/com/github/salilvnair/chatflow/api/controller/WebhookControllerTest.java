package com.github.salilvnair.chatflow.api.controller;

import com.github.salilvnair.chatflow.api.dto.WebhookEventRequest;
import com.github.salilvnair.chatflow.api.dto.WebhookEventResponse;
import com.github.salilvnair.chatflow.config.ChatFlowGatewayConfig;
import com.github.salilvnair.chatflow.delivery.OutboundPayload;
import com.github.salilvnair.chatflow.engine.core.ConversationalEngine;
import com.github.salilvnair.chatflow.engine.exception.ChatFlowErrorCode;
import com.github.salilvnair.chatflow.engine.exception.ValidationException;
import com.github.salilvnair.chatflow.engine.model.EngineResult;
import com.github.salilvnair.chatflow.engine.model.InboundEvent;
import com.github.salilvnair.chatflow.engine.model.InboundEventType;
import com.github.salilvnair.chatflow.engine.state.ConversationState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static com.github.salilvnair.chatflow.support.TestConstants.BOOM;
import static com.github.salilvnair.chatflow.support.TestConstants.MEDIA_REF;
import static com.github.salilvnair.chatflow.support.TestConstants.T0;
import static com.github.salilvnair.chatflow.support.TestConstants.USER_ID;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebhookControllerTest {

    private final ConversationalEngine engine = mock(ConversationalEngine.class);
    private final ChatFlowGatewayConfig gatewayConfig = new ChatFlowGatewayConfig();
    private final WebhookController controller = new WebhookController(engine, gatewayConfig);

    @BeforeEach
    void setUp() {
        gatewayConfig.setVerifyToken("s3cret");
    }

    @Test
    void verificationEchoesChallenge() {
        ResponseEntity<String> ok = controller.verify("subscribe", "s3cret", "12345");
        ResponseEntity<String> rejected = controller.verify("subscribe", "wrong", "12345");

        assertEquals("12345", ok.getBody());
        assertEquals(HttpStatus.FORBIDDEN, rejected.getStatusCode());
    }

    @Test
    void eventIsProcessedAndRepliesReturned() {
        when(engine.process(any())).thenReturn(new EngineResult(USER_ID, ConversationState.GST_MENU,
                List.of(OutboundPayload.text("GST menu")), 2L, false));

        ResponseEntity<WebhookEventResponse> response = controller.events(request("text", "1"));

        WebhookEventResponse body = response.getBody();
        assertNotNull(body);
        assertTrue(body.isSuccess());
        assertEquals("GST_MENU", body.getState());
        assertEquals(2L, body.getVersion());
        assertEquals(List.of(new WebhookEventResponse.ApiReply("TEXT", "GST menu", null)), body.getReplies());

        ArgumentCaptor<InboundEvent> event = ArgumentCaptor.forClass(InboundEvent.class);
        verify(engine).process(event.capture());
        assertEquals(InboundEventType.TEXT, event.getValue().type());
        assertEquals("1", event.getValue().text());
    }

    @Test
    void camelCaseTypeIsAccepted() {
        WebhookEventRequest request = request("interactiveReply", "1");

        assertEquals(InboundEventType.INTERACTIVE_REPLY, WebhookController.toEvent(request).type());
        request.setType("document");
        request.setMediaRef(MEDIA_REF);
        assertEquals(MEDIA_REF, WebhookController.toEvent(request).mediaRef());
    }

    @Test
    void unknownTypeIsBadRequest() {
        ResponseEntity<WebhookEventResponse> response = controller.events(request("sticker", null));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals(ChatFlowErrorCode.INVALID_INPUT.name(), response.getBody().getError().errorCode());
        verify(engine, never()).process(any());
    }

    @Test
    void engineValidationFailureIsBadRequest() {
        when(engine.process(any())).thenThrow(
                new ValidationException(ChatFlowErrorCode.INVALID_INPUT, "error.missing_sender", null));

        ResponseEntity<WebhookEventResponse> response = controller.events(request("text", "hi"));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertFalse(response.getBody().isSuccess());
    }

    @Test
    void unexpectedFailureIsServerError() {
        when(engine.process(any())).thenThrow(new IllegalStateException(BOOM));

        ResponseEntity<WebhookEventResponse> response = controller.events(request("text", "hi"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("INTERNAL_ERROR", response.getBody().getError().errorCode());
    }

    private static WebhookEventRequest request(String type, String text) {
        WebhookEventRequest request = new WebhookEventRequest();
        request.setMessageId("wamid.1");
        request.setSenderId(USER_ID);
        request.setType(type);
        request.setText(text);
        request.setTimestamp(T0);
        return request;
    }
}
