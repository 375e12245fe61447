package com.github.salilvnair.chatflow.engine.state;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-user conversational state.
 * <p>
 * The current {@code state} is never on the {@link NavigationStack}; every state change
 * goes through {@link #transitionTo(ConversationState, boolean)} or {@link #goBack()}
 * which keep that true.
 */
@Getter
public class ChatSession {

    /** Profile keys that survive a flow reset. */
    public static final Set<String> PROFILE_KEYS = Set.of(
            "gstin",
            "business_name",
            "gst_onboarded",
            "filing_mode",
            "multi_gstin",
            "notification_prefs"
    );

    /** Prefixes of flow-scoped keys dropped when a flow is abandoned. */
    public static final List<String> FLOW_PREFIXES = List.of(
            "wizard_", "payment_", "gst_filing_", "itr_", "nil_", "invoice_", "credit_", "switch_", "multi_pending_"
    );

    private final String userId;
    private ConversationState state;
    @Setter
    private Language language;
    private final NavigationStack stack;
    private final Map<String, Object> data;
    @Setter
    private long version;
    @Setter
    private Instant lastActive;
    private final LinkedHashSet<String> recentEventIds;

    public ChatSession(
            String userId,
            ConversationState state,
            Language language,
            NavigationStack stack,
            Map<String, Object> data,
            long version,
            Instant lastActive,
            Set<String> recentEventIds
    ) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.state = Objects.requireNonNull(state, "state");
        this.language = language == null ? Language.EN : language;
        this.stack = Objects.requireNonNull(stack, "stack");
        this.data = data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data);
        this.version = version;
        this.lastActive = lastActive;
        this.recentEventIds = recentEventIds == null ? new LinkedHashSet<>() : new LinkedHashSet<>(recentEventIds);
    }

    public static ChatSession create(String userId, Language language, int stackDepth, Instant now) {
        return new ChatSession(
                userId,
                ConversationState.MAIN_MENU,
                language,
                new NavigationStack(stackDepth),
                new LinkedHashMap<>(),
                0L,
                now,
                new LinkedHashSet<>()
        );
    }

    /**
     * Moves to {@code next}. If {@code next} is already on the stack the stack is unwound
     * to below it; otherwise the current state is pushed when {@code pushCurrent} is set.
     * Entering {@link ConversationState#MAIN_MENU} always empties the stack.
     *
     * @return {@code false} only when a requested push was rejected by a full stack
     */
    public boolean transitionTo(ConversationState next, boolean pushCurrent) {
        Objects.requireNonNull(next, "next");
        if (next == ConversationState.MAIN_MENU) {
            stack.clear();
            state = next;
            return true;
        }
        if (next == state) {
            return true;
        }
        boolean pushed = true;
        if (stack.contains(next)) {
            stack.unwindTo(next);
        }
        else if (pushCurrent && state != ConversationState.MAIN_MENU) {
            pushed = stack.push(state);
        }
        state = next;
        return pushed;
    }

    /**
     * Pops the stack and enters the popped state.
     *
     * @return the state entered, or {@code null} when the stack was empty
     */
    public ConversationState goBack() {
        ConversationState previous = stack.pop().orElse(null);
        if (previous != null) {
            state = previous;
        }
        return previous;
    }

    /** Enters {@code target} with an empty stack, as when a new module is opened from scratch. */
    public void restartAt(ConversationState target) {
        stack.clear();
        state = Objects.requireNonNull(target, "target");
    }

    /** Clears data, stack and state. Language and identity are kept. */
    public void reset() {
        data.clear();
        stack.clear();
        state = ConversationState.MAIN_MENU;
    }

    /** Drops flow-scoped data while keeping the profile keys. */
    public void clearFlowData() {
        data.keySet().removeIf(key -> !PROFILE_KEYS.contains(key)
                && FLOW_PREFIXES.stream().anyMatch(key::startsWith));
    }

    public Object get(String key) {
        return data.get(key);
    }

    public String getString(String key) {
        Object value = data.get(key);
        return value == null ? null : String.valueOf(value);
    }

    public void put(String key, Object value) {
        if (value == null) {
            data.remove(key);
        }
        else {
            data.put(key, value);
        }
    }

    public Object remove(String key) {
        return data.remove(key);
    }

    public boolean hasProcessed(String eventId) {
        return eventId != null && recentEventIds.contains(eventId);
    }

    public void markProcessed(String eventId, int keep) {
        if (eventId == null) {
            return;
        }
        recentEventIds.remove(eventId);
        recentEventIds.add(eventId);
        while (recentEventIds.size() > Math.max(1, keep)) {
            String eldest = recentEventIds.iterator().next();
            recentEventIds.remove(eldest);
        }
    }

    public ChatSession copy() {
        return new ChatSession(
                userId,
                state,
                language,
                stack.copy(),
                deepCopy(data),
                version,
                lastActive,
                recentEventIds
        );
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : source.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> map) {
                value = deepCopy((Map<String, Object>) map);
            }
            else if (value instanceof List<?> list) {
                value = new ArrayList<>(list);
            }
            out.put(entry.getKey(), value);
        }
        return out;
    }

    @Override
    public String toString() {
        return "ChatSession{userId=" + userId + ", state=" + state + ", stack=" + stack + ", version=" + version + "}";
    }
}
