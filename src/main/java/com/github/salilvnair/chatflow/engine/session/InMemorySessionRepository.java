package com.github.salilvnair.chatflow.engine.session;

import com.github.salilvnair.chatflow.config.ChatFlowSessionConfig;
import com.github.salilvnair.chatflow.engine.exception.ConcurrencyConflictException;
import com.github.salilvnair.chatflow.engine.state.ChatSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@RequiredArgsConstructor
public class InMemorySessionRepository implements SessionRepository {

    private final ChatFlowSessionConfig sessionConfig;
    private final Clock clock;
    private final Map<String, ChatSession> sessions = new ConcurrentHashMap<>();

    @Override
    public Optional<ChatSession> load(String userId) {
        ChatSession stored = sessions.get(userId);
        if (stored == null) {
            return Optional.empty();
        }
        if (isExpired(stored, clock.instant())) {
            sessions.remove(userId, stored);
            log.info("Session expired userId={} lastActive={}", userId, stored.getLastActive());
            return Optional.empty();
        }
        return Optional.of(stored.copy());
    }

    @Override
    public long save(ChatSession session, long expectedVersion) {
        long nextVersion = expectedVersion + 1;
        sessions.compute(session.getUserId(), (userId, current) -> {
            long actual = current == null ? 0L : current.getVersion();
            if (actual != expectedVersion) {
                throw new ConcurrencyConflictException(userId, expectedVersion, actual);
            }
            ChatSession stored = session.copy();
            stored.setVersion(nextVersion);
            return stored;
        });
        session.setVersion(nextVersion);
        return nextVersion;
    }

    @Override
    public void delete(String userId) {
        sessions.remove(userId);
    }

    @Scheduled(fixedDelayString = "${chatflow.session.sweep-interval-ms:60000}")
    public void evictExpired() {
        Instant now = clock.instant();
        int before = sessions.size();
        sessions.entrySet().removeIf(entry -> isExpired(entry.getValue(), now));
        int removed = before - sessions.size();
        if (removed > 0) {
            log.info("Evicted {} idle sessions", removed);
        }
    }

    public int size() {
        return sessions.size();
    }

    private boolean isExpired(ChatSession session, Instant now) {
        Duration ttl = sessionConfig.getTtl();
        Instant lastActive = session.getLastActive();
        return ttl != null && lastActive != null && lastActive.plus(ttl).isBefore(now);
    }
}
