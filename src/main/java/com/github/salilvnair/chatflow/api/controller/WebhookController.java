package com.github.salilvnair.chatflow.api.controller;

import com.github.salilvnair.chatflow.api.dto.ErrorPayload;
import com.github.salilvnair.chatflow.api.dto.WebhookEventRequest;
import com.github.salilvnair.chatflow.api.dto.WebhookEventResponse;
import com.github.salilvnair.chatflow.config.ChatFlowGatewayConfig;
import com.github.salilvnair.chatflow.delivery.OutboundPayload;
import com.github.salilvnair.chatflow.engine.core.ConversationalEngine;
import com.github.salilvnair.chatflow.engine.exception.ChatFlowErrorCode;
import com.github.salilvnair.chatflow.engine.exception.ChatFlowException;
import com.github.salilvnair.chatflow.engine.model.EngineResult;
import com.github.salilvnair.chatflow.engine.model.InboundEvent;
import com.github.salilvnair.chatflow.engine.model.InboundEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;

@Slf4j
@RestController
@RequestMapping("/api/v1/webhook")
@RequiredArgsConstructor
public class WebhookController {

    private final ConversationalEngine engine;
    private final ChatFlowGatewayConfig gatewayConfig;

    /** Subscription handshake: echo the challenge when the verify token matches. */
    @GetMapping
    public ResponseEntity<String> verify(@RequestParam(name = "hub.mode", required = false) String mode,
                                         @RequestParam(name = "hub.verify_token", required = false) String token,
                                         @RequestParam(name = "hub.challenge", required = false) String challenge) {
        String expected = gatewayConfig.getVerifyToken();
        if ("subscribe".equals(mode) && expected != null && expected.equals(token)) {
            return ResponseEntity.ok(challenge);
        }
        log.warn("Webhook verification rejected mode={}", mode);
        return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
    }

    @PostMapping("/events")
    public ResponseEntity<WebhookEventResponse> events(@RequestBody WebhookEventRequest request) {
        try {
            EngineResult result = engine.process(toEvent(request));
            WebhookEventResponse res = new WebhookEventResponse();
            res.setSuccess(true);
            res.setUserId(result.userId());
            res.setState(result.state() == null ? null : result.state().name());
            res.setVersion(result.version());
            res.setDuplicate(result.duplicate());
            res.setReplies(result.replies().stream().map(WebhookController::toApiReply).toList());
            return ResponseEntity.ok(res);
        }
        catch (ChatFlowException ex) {
            log.warn("Webhook event rejected messageId={} errorCode={} msg={}",
                    request.getMessageId(), ex.getErrorCode(), ex.getMessage());
            return ResponseEntity.badRequest().body(error(new ErrorPayload(ex.getErrorCode(), ex.getMessage(), ex.isRecoverable())));
        }
        catch (Exception ex) {
            log.error("Webhook event failed messageId={}", request.getMessageId(), ex);
            return ResponseEntity.internalServerError().body(error(new ErrorPayload("INTERNAL_ERROR", ex.getMessage(), false)));
        }
    }

    static InboundEvent toEvent(WebhookEventRequest request) {
        InboundEventType type;
        try {
            type = request.getType() == null
                    ? InboundEventType.TEXT
                    : InboundEventType.valueOf(request.getType().trim()
                            .replaceAll("([a-z])([A-Z])", "$1_$2")
                            .toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException e) {
            throw new ChatFlowException(ChatFlowErrorCode.INVALID_INPUT, "Unsupported event type: " + request.getType());
        }
        return InboundEvent.builder()
                .messageId(request.getMessageId())
                .senderId(request.getSenderId())
                .type(type)
                .text(request.getText())
                .mediaRef(request.getMediaRef())
                .timestamp(request.getTimestamp())
                .build();
    }

    private static WebhookEventResponse.ApiReply toApiReply(OutboundPayload payload) {
        if (payload instanceof OutboundPayload.Media media) {
            return new WebhookEventResponse.ApiReply(media.kind().name(), media.caption(), media.mediaRef());
        }
        return new WebhookEventResponse.ApiReply("TEXT", ((OutboundPayload.Text) payload).body(), null);
    }

    private static WebhookEventResponse error(ErrorPayload payload) {
        WebhookEventResponse res = new WebhookEventResponse();
        res.setSuccess(false);
        res.setError(payload);
        return res;
    }
}
