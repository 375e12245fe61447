package com.github.salilvnair.chatflow.engine.transition;

import com.github.salilvnair.chatflow.engine.exception.ChatFlowErrorCode;
import com.github.salilvnair.chatflow.engine.exception.ChatFlowException;
import com.github.salilvnair.chatflow.engine.state.ConversationState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable {@code (state, input kind, token) -> rule} table. An exact-token rule wins over
 * the kind-wide rule of the same state.
 */
public final class TransitionTable {

    private final Map<TransitionKey, TransitionRule> rules;

    private TransitionTable(Map<TransitionKey, TransitionRule> rules) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<TransitionRule> find(ConversationState state, ClassifiedInput input) {
        if (input.token() != null) {
            TransitionRule exact = rules.get(new TransitionKey(state, input.kind(), input.token()));
            if (exact != null) {
                return Optional.of(exact);
            }
        }
        return Optional.ofNullable(rules.get(new TransitionKey(state, input.kind(), null)));
    }

    public int size() {
        return rules.size();
    }

    public Set<ConversationState> states() {
        return rules.keySet().stream().map(TransitionKey::state).collect(Collectors.toSet());
    }

    public static final class Builder {

        private final Map<TransitionKey, TransitionRule> rules = new LinkedHashMap<>();

        public Builder rule(ConversationState state, InputKind kind, String token, TransitionRule rule) {
            TransitionKey key = new TransitionKey(state, kind, token);
            if (rules.putIfAbsent(key, rule) != null) {
                throw new ChatFlowException(
                        ChatFlowErrorCode.DUPLICATE_TRANSITION_RULE,
                        "Duplicate transition rule " + key
                );
            }
            return this;
        }

        /** Menu choice that opens a sub-flow the user can go back from. */
        public Builder choice(ConversationState state, String token, ConversationState next) {
            return rule(state, InputKind.NUMERIC_CHOICE, token, new TransitionRule(TransitionAction.NONE, next, true));
        }

        public Builder choice(ConversationState state, String token, ConversationState next, boolean push, TransitionAction action) {
            return rule(state, InputKind.NUMERIC_CHOICE, token, new TransitionRule(action, next, push));
        }

        /** Any text in {@code state}; used for question steps of a wizard. */
        public Builder text(ConversationState state, ConversationState next, TransitionAction action) {
            return rule(state, InputKind.FREE_TEXT, null, new TransitionRule(action, next, false));
        }

        public Builder keyword(ConversationState state, String keyword, ConversationState next, TransitionAction action) {
            return rule(state, InputKind.FREE_TEXT, keyword, new TransitionRule(action, next, false));
        }

        public Builder confirmation(ConversationState state, String token, ConversationState next, TransitionAction action) {
            return rule(state, InputKind.CONFIRMATION, token, new TransitionRule(action, next, false));
        }

        public TransitionTable build() {
            return new TransitionTable(rules);
        }
    }
}
