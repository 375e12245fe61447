package com.github.salilvnair.chatflow.engine.transition;

import com.github.salilvnair.chatflow.engine.state.ConversationState;

/**
 * @param nextState   state entered after the action, {@code null} to stay
 * @param pushCurrent push the current state first so the user can go back to it
 */
public record TransitionRule(TransitionAction action, ConversationState nextState, boolean pushCurrent) {

    public TransitionRule {
        action = action == null ? TransitionAction.NONE : action;
    }
}
