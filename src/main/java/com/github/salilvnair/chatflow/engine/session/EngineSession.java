package com.github.salilvnair.chatflow.engine.session;

import com.github.salilvnair.chatflow.delivery.OutboundPayload;
import com.github.salilvnair.chatflow.engine.model.EngineResult;
import com.github.salilvnair.chatflow.engine.model.InboundEvent;
import com.github.salilvnair.chatflow.engine.state.ChatSession;
import com.github.salilvnair.chatflow.engine.state.ConversationState;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Working context for one inbound event. Steps and handlers mutate {@link #getSession()},
 * a copy of the stored session; {@link #getOriginal()} is left as loaded.
 */
@Getter
public class EngineSession {

    private final InboundEvent event;
    private final ChatSession session;
    private final ChatSession original;
    private final boolean newSession;
    private final Instant now;
    private final List<OutboundPayload> replies = new ArrayList<>();
    private boolean readOnly;
    @Setter
    private String handledBy;

    public EngineSession(InboundEvent event, ChatSession stored, boolean newSession, Instant now) {
        this.event = event;
        this.original = stored;
        this.session = stored.copy();
        this.newSession = newSession;
        this.now = now;
    }

    public String getUserId() {
        return session.getUserId();
    }

    public ConversationState getState() {
        return session.getState();
    }

    public String userText() {
        return event.textOrEmpty().trim();
    }

    public void addReply(OutboundPayload payload) {
        if (payload != null) {
            replies.add(payload);
        }
    }

    public void addReplies(List<OutboundPayload> payloads) {
        if (payloads != null) {
            payloads.forEach(this::addReply);
        }
    }

    /** The event must not be persisted: no version bump, no idempotency record. */
    public void markReadOnly() {
        this.readOnly = true;
    }

    public EngineResult toResult() {
        return new EngineResult(session.getUserId(), session.getState(), List.copyOf(replies), session.getVersion(), false);
    }
}
