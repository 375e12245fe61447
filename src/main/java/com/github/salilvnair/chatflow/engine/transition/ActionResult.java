package com.github.salilvnair.chatflow.engine.transition;

import com.github.salilvnair.chatflow.engine.state.ConversationState;

/**
 * What a {@link TransitionAction} decided.
 *
 * @param redirect   overrides the rule's next state when not {@code null}
 * @param stay       keep the current state even if the rule names a next state
 * @param showPrompt append the prompt of the resulting state to the replies
 */
public record ActionResult(ConversationState redirect, boolean stay, boolean showPrompt) {

    private static final ActionResult PROCEED = new ActionResult(null, false, true);

    public static ActionResult proceed() {
        return PROCEED;
    }

    public static ActionResult redirect(ConversationState state) {
        return new ActionResult(state, false, true);
    }

    /** Stay in the current state; the action supplied its own replies. */
    public static ActionResult hold() {
        return new ActionResult(null, true, false);
    }
}
