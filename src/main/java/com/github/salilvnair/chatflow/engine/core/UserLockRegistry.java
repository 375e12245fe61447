package com.github.salilvnair.chatflow.engine.core;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per user id, held for the whole transition. Entries are dropped once no
 * thread holds or waits for them.
 */
@Component
public class UserLockRegistry {

    private final ConcurrentHashMap<String, LockEntry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String userId, Supplier<T> work) {
        LockEntry entry = locks.compute(userId, (key, current) -> {
            LockEntry e = current == null ? new LockEntry() : current;
            e.holders++;
            return e;
        });
        entry.lock.lock();
        try {
            return work.get();
        }
        finally {
            entry.lock.unlock();
            locks.computeIfPresent(userId, (key, current) -> --current.holders == 0 ? null : current);
        }
    }

    int activeUsers() {
        return locks.size();
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int holders;
    }
}
