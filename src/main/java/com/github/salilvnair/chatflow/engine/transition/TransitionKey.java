package com.github.salilvnair.chatflow.engine.transition;

import com.github.salilvnair.chatflow.engine.state.ConversationState;

/**
 * @param token exact token, or {@code null} for any input of {@code kind}
 */
public record TransitionKey(ConversationState state, InputKind kind, String token) {
}
