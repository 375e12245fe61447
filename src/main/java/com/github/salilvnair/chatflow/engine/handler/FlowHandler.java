package com.github.salilvnair.chatflow.engine.handler;

import com.github.salilvnair.chatflow.engine.session.EngineSession;
import com.github.salilvnair.chatflow.engine.state.ConversationState;

/**
 * A vertical flow owning a subset of states. Registered in {@link HandlerChain}, where
 * the first handler claiming the current state receives the event.
 */
public interface FlowHandler {

    boolean claims(ConversationState state);

    /**
     * Handles the event for a claimed state. Returning {@link HandlerOutcome.Pass} hands the
     * event to the transition table.
     */
    HandlerOutcome handle(EngineSession session);

    default String name() {
        return getClass().getSimpleName();
    }
}
