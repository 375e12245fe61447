package com.github.salilvnair.chatflow.delivery.dead;

import com.github.salilvnair.chatflow.delivery.OutboundDeliveryPipeline;
import com.github.salilvnair.chatflow.delivery.OutboundMessage;
import com.github.salilvnair.chatflow.engine.exception.ChatFlowErrorCode;
import com.github.salilvnair.chatflow.engine.exception.ChatFlowException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Operator facade over the dead-letter store.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeadLetterManager {

    private final DeadLetterStore store;
    private final OutboundDeliveryPipeline pipeline;
    private final Clock clock;

    public List<DeadLetterEntry> listDeadLetters(DeadLetterFilter filter) {
        return store.query(filter == null ? DeadLetterFilter.all() : filter);
    }

    public DeadLetterEntry getDeadLetter(String deadLetterId) {
        return store.findById(deadLetterId)
                .orElseThrow(() -> notFound(deadLetterId));
    }

    public long count(DeadLetterFilter filter) {
        return store.count(filter == null ? DeadLetterFilter.all() : filter);
    }

    /**
     * Enqueues a fresh copy of a dead letter with attempt count zero. The original entry
     * is kept as is.
     *
     * @return id of the new outbound message
     */
    public String replay(String deadLetterId) {
        DeadLetterEntry entry = getDeadLetter(deadLetterId);
        OutboundMessage message = OutboundMessage.replayOf(entry.id(), entry.recipient(), entry.payload(), clock.instant());
        boolean queued = pipeline.enqueue(message);
        log.info("Dead letter replayed id={} recipient={} newMessageId={} queued={}",
                entry.id(), entry.recipient(), message.getId(), queued);
        return message.getId();
    }

    private static ChatFlowException notFound(String deadLetterId) {
        return new ChatFlowException(ChatFlowErrorCode.DEAD_LETTER_NOT_FOUND, "Dead letter not found: " + deadLetterId);
    }
}
