package com.github.salilvnair.chatflow.engine.core;

import com.github.salilvnair.chatflow.config.ChatFlowSessionConfig;
import com.github.salilvnair.chatflow.delivery.OutboundDeliveryPipeline;
import com.github.salilvnair.chatflow.delivery.OutboundMessage;
import com.github.salilvnair.chatflow.delivery.OutboundPayload;
import com.github.salilvnair.chatflow.engine.exception.ChatFlowErrorCode;
import com.github.salilvnair.chatflow.engine.exception.ConcurrencyConflictException;
import com.github.salilvnair.chatflow.engine.exception.DomainServiceException;
import com.github.salilvnair.chatflow.engine.exception.ValidationException;
import com.github.salilvnair.chatflow.engine.factory.EnginePipelineFactory;
import com.github.salilvnair.chatflow.engine.model.EngineResult;
import com.github.salilvnair.chatflow.engine.model.InboundEvent;
import com.github.salilvnair.chatflow.engine.session.EngineSession;
import com.github.salilvnair.chatflow.engine.session.SessionRepository;
import com.github.salilvnair.chatflow.engine.state.ChatSession;
import com.github.salilvnair.chatflow.i18n.ReplyComposer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Runs one inbound event through the pipeline under the sender's lock and commits the
 * session with a version check. Replies are handed to the delivery pipeline.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DefaultConversationalEngine implements ConversationalEngine {

    private final EnginePipelineFactory pipelineFactory;
    private final SessionRepository sessionRepository;
    private final UserLockRegistry lockRegistry;
    private final OutboundDeliveryPipeline deliveryPipeline;
    private final ReplyComposer replies;
    private final ChatFlowSessionConfig sessionConfig;
    private final Clock clock;

    @Override
    public EngineResult process(InboundEvent event) {
        if (event == null || event.senderId() == null || event.senderId().isBlank()) {
            throw new ValidationException(ChatFlowErrorCode.INVALID_INPUT, "error.missing_sender", null);
        }
        return lockRegistry.withLock(event.senderId(), () -> processLocked(event));
    }

    private EngineResult processLocked(InboundEvent event) {
        String userId = event.senderId();
        int maxAttempts = Math.max(1, sessionConfig.getMaxConflictRetries());
        ChatSession lastSeen = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Instant now = clock.instant();
            Optional<ChatSession> stored = sessionRepository.load(userId);
            ChatSession base = stored.orElseGet(() -> ChatSession.create(
                    userId,
                    sessionConfig.getDefaultLanguage(),
                    sessionConfig.getStackDepth(),
                    now
            ));
            lastSeen = base;

            if (base.hasProcessed(event.messageId())) {
                log.info("Duplicate event ignored userId={} messageId={} state={}", userId, event.messageId(), base.getState());
                return new EngineResult(userId, base.getState(), List.of(), base.getVersion(), true);
            }

            EngineSession session = new EngineSession(event, base, stored.isEmpty(), now);
            EngineResult result;
            try {
                result = pipelineFactory.create().execute(session);
            }
            catch (ValidationException e) {
                log.debug("Input rejected userId={} state={} key={}", userId, base.getState(), e.getMessageKey());
                return deliver(base, List.of(replies.noticeWithPrompt(base, e.getMessageKey(), e.getMessageVars())));
            }
            catch (DomainServiceException e) {
                log.warn("Domain service failed userId={} state={} service={} msg={}",
                        userId, base.getState(), e.getService(), e.getMessage());
                return deliver(base, List.of(replies.message(base, ReplyComposer.APOLOGY)));
            }

            if (session.isReadOnly()) {
                return deliver(base, result.replies());
            }

            ChatSession working = session.getSession();
            working.setLastActive(now);
            working.markProcessed(event.messageId(), sessionConfig.getRecentEventIds());
            try {
                sessionRepository.save(working, base.getVersion());
                return deliver(working, result.replies());
            }
            catch (ConcurrencyConflictException e) {
                log.warn("Session conflict userId={} attempt={}/{} expected={} actual={}",
                        userId, attempt, maxAttempts, e.getExpectedVersion(), e.getActualVersion());
            }
        }

        log.error("Session conflict retries exhausted userId={} messageId={} code={}",
                userId, event.messageId(), ChatFlowErrorCode.SESSION_CONFLICT_RETRIES_EXHAUSTED);
        return deliver(lastSeen, List.of(replies.message(lastSeen, ReplyComposer.APOLOGY)));
    }

    private EngineResult deliver(ChatSession session, List<OutboundPayload> payloads) {
        Instant now = clock.instant();
        for (OutboundPayload payload : payloads) {
            deliveryPipeline.enqueue(OutboundMessage.create(session.getUserId(), payload, now));
        }
        return new EngineResult(session.getUserId(), session.getState(), List.copyOf(payloads), session.getVersion(), false);
    }
}
