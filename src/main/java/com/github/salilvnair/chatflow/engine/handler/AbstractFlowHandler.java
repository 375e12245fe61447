package com.github.salilvnair.chatflow.engine.handler;

import com.github.salilvnair.chatflow.delivery.OutboundPayload;
import com.github.salilvnair.chatflow.engine.session.EngineSession;
import com.github.salilvnair.chatflow.engine.state.ChatSession;
import com.github.salilvnair.chatflow.engine.state.ConversationState;
import com.github.salilvnair.chatflow.i18n.ReplyComposer;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public abstract class AbstractFlowHandler implements FlowHandler {

    protected final ReplyComposer replies;
    private final Set<ConversationState> claimedStates;

    protected AbstractFlowHandler(ReplyComposer replies, ConversationState first, ConversationState... rest) {
        this.replies = replies;
        this.claimedStates = EnumSet.of(first, rest);
    }

    @Override
    public boolean claims(ConversationState state) {
        return claimedStates.contains(state);
    }

    public Set<ConversationState> claimedStates() {
        return claimedStates;
    }

    /** Moves to {@code next} and returns its prompt. */
    protected OutboundPayload enter(EngineSession session, ConversationState next, boolean pushCurrent) {
        ChatSession chat = session.getSession();
        chat.transitionTo(next, pushCurrent);
        return replies.prompt(chat);
    }

    protected OutboundPayload message(EngineSession session, String key, Map<String, Object> variables) {
        return replies.message(session.getSession(), key, variables);
    }

    protected OutboundPayload message(EngineSession session, String key) {
        return replies.message(session.getSession(), key);
    }

    protected OutboundPayload noticeWithPrompt(EngineSession session, String key) {
        return replies.noticeWithPrompt(session.getSession(), key, Map.of());
    }
}
