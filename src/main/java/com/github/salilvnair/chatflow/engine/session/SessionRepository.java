package com.github.salilvnair.chatflow.engine.session;

import com.github.salilvnair.chatflow.engine.exception.ConcurrencyConflictException;
import com.github.salilvnair.chatflow.engine.state.ChatSession;

import java.util.Optional;

/**
 * Storage for {@link ChatSession}s keyed by user id, with an optimistic version token.
 * Implementations expire sessions that have been idle for longer than their TTL.
 */
public interface SessionRepository {

    Optional<ChatSession> load(String userId);

    /**
     * Stores {@code session} if the stored version still equals {@code expectedVersion}
     * ({@code 0} for a session that was never saved). The stored copy carries
     * {@code expectedVersion + 1}, which is also written back to {@code session}.
     *
     * @throws ConcurrencyConflictException when another writer saved first
     */
    long save(ChatSession session, long expectedVersion);

    void delete(String userId);
}
