package com.github.salilvnair.chatflow.engine.command;

import com.github.salilvnair.chatflow.engine.state.ChatSession;
import com.github.salilvnair.chatflow.engine.state.ConversationState;
import com.github.salilvnair.chatflow.engine.state.SessionKeys;

/**
 * Result of intercepting a reserved token: what to do to the session and where it ends up.
 * Computed without touching the session; {@link #applyTo(ChatSession)} performs it.
 */
public record CommandTransition(
        GlobalCommand command,
        Effect effect,
        ConversationState target
) {

    public enum Effect {
        /** Clear the stack and flow data, land on the main menu. */
        GO_HOME,
        /** Pop the stack and enter the popped state. */
        POP,
        /** Stack empty outside the main menu: the implicit root is the main menu. */
        POP_TO_ROOT,
        /** Stack empty at the main menu. */
        NOTHING_TO_POP,
        /** Push the current state and jump to {@link #target()}. */
        PUSH_AND_JUMP,
        SHOW_HELP,
        WIPE,
        HANDOFF
    }

    public boolean mutatesSession() {
        return command.mutatesSession();
    }

    public void applyTo(ChatSession session) {
        switch (effect) {
            case GO_HOME -> {
                session.clearFlowData();
                session.transitionTo(ConversationState.MAIN_MENU, false);
            }
            case POP -> session.goBack();
            case POP_TO_ROOT -> session.transitionTo(ConversationState.MAIN_MENU, false);
            case PUSH_AND_JUMP -> session.transitionTo(target, true);
            case WIPE -> session.reset();
            case HANDOFF -> session.put(SessionKeys.CA_HANDOFF, Boolean.TRUE);
            case NOTHING_TO_POP, SHOW_HELP -> {
                // no session change
            }
        }
    }
}
