package com.github.salilvnair.chatflow.api.controller;

import com.github.salilvnair.chatflow.api.dto.DeadLetterResponse;
import com.github.salilvnair.chatflow.api.dto.ErrorPayload;
import com.github.salilvnair.chatflow.delivery.dead.DeadLetterFilter;
import com.github.salilvnair.chatflow.delivery.dead.DeadLetterManager;
import com.github.salilvnair.chatflow.delivery.dead.FailureReason;
import com.github.salilvnair.chatflow.engine.exception.ChatFlowErrorCode;
import com.github.salilvnair.chatflow.engine.exception.ChatFlowException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/dead-letters")
@RequiredArgsConstructor
public class DeadLetterController {

    private final DeadLetterManager deadLetterManager;

    @GetMapping
    public ResponseEntity<?> list(@RequestParam(required = false) String recipient,
                                  @RequestParam(required = false) String reason,
                                  @RequestParam(defaultValue = "100") int limit) {
        try {
            DeadLetterFilter filter = new DeadLetterFilter(recipient, parseReason(reason), limit);
            List<DeadLetterResponse> entries = deadLetterManager.listDeadLetters(filter).stream()
                    .map(DeadLetterResponse::from)
                    .toList();
            return ResponseEntity.ok(entries);
        }
        catch (ChatFlowException ex) {
            return ResponseEntity.badRequest().body(new ErrorPayload(ex.getErrorCode(), ex.getMessage(), ex.isRecoverable()));
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable String id) {
        try {
            return ResponseEntity.ok(DeadLetterResponse.from(deadLetterManager.getDeadLetter(id)));
        }
        catch (ChatFlowException ex) {
            return ResponseEntity.status(statusOf(ex)).body(new ErrorPayload(ex.getErrorCode(), ex.getMessage(), ex.isRecoverable()));
        }
    }

    @PostMapping("/{id}/replay")
    public ResponseEntity<?> replay(@PathVariable String id) {
        try {
            String messageId = deadLetterManager.replay(id);
            return ResponseEntity.accepted().body(Map.of("deadLetterId", id, "messageId", messageId));
        }
        catch (ChatFlowException ex) {
            return ResponseEntity.status(statusOf(ex)).body(new ErrorPayload(ex.getErrorCode(), ex.getMessage(), ex.isRecoverable()));
        }
    }

    private static HttpStatus statusOf(ChatFlowException ex) {
        return ChatFlowErrorCode.DEAD_LETTER_NOT_FOUND.name().equals(ex.getErrorCode())
                ? HttpStatus.NOT_FOUND
                : HttpStatus.BAD_REQUEST;
    }

    private static FailureReason parseReason(String reason) {
        if (reason == null || reason.isBlank()) {
            return null;
        }
        try {
            return FailureReason.valueOf(reason.trim().toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException e) {
            throw new ChatFlowException(ChatFlowErrorCode.INVALID_INPUT, "Unknown failure reason: " + reason);
        }
    }
}
