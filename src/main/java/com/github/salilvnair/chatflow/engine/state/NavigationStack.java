package com.github.salilvnair.chatflow.engine.state;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Bounded history of prior states, most recent last.
 * <p>
 * {@link ConversationState#MAIN_MENU} is the implicit root and is never stored.
 * A push beyond {@link #capacity()} is rejected: the existing entries are kept,
 * a warning is logged and {@code false} is returned to the caller.
 */
@Slf4j
public final class NavigationStack {

    private final int capacity;
    private final Deque<ConversationState> entries;

    public NavigationStack(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    public static NavigationStack of(int capacity, List<ConversationState> bottomToTop) {
        NavigationStack stack = new NavigationStack(capacity);
        if (bottomToTop != null) {
            bottomToTop.forEach(stack::push);
        }
        return stack;
    }

    public boolean push(ConversationState state) {
        if (state == null || state == ConversationState.MAIN_MENU) {
            return false;
        }
        if (entries.size() >= capacity) {
            log.warn("Navigation stack full, push rejected state={} depth={} top={}", state, entries.size(), entries.peekLast());
            return false;
        }
        entries.addLast(state);
        return true;
    }

    public Optional<ConversationState> pop() {
        return Optional.ofNullable(entries.pollLast());
    }

    public Optional<ConversationState> peek() {
        return Optional.ofNullable(entries.peekLast());
    }

    public boolean contains(ConversationState state) {
        return entries.contains(state);
    }

    /**
     * Pops entries down to and including {@code state}.
     *
     * @return {@code true} when {@code state} was on the stack
     */
    public boolean unwindTo(ConversationState state) {
        if (!entries.contains(state)) {
            return false;
        }
        ConversationState popped;
        do {
            popped = entries.pollLast();
        } while (popped != null && popped != state);
        return true;
    }

    public void clear() {
        entries.clear();
    }

    public int depth() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public boolean isFull() {
        return entries.size() >= capacity;
    }

    public List<ConversationState> asList() {
        List<ConversationState> out = new ArrayList<>(entries.size());
        Iterator<ConversationState> it = entries.iterator();
        while (it.hasNext()) {
            out.add(it.next());
        }
        return out;
    }

    public NavigationStack copy() {
        NavigationStack copy = new NavigationStack(capacity);
        copy.entries.addAll(entries);
        return copy;
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
