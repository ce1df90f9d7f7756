package com.example.chatsync.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per session id. Entries are reference counted and dropped once no
 * thread holds or waits for them, so idle sessions cost nothing.
 */
@Component
public class SessionLockRegistry {

    private final ConcurrentHashMap<String, LockEntry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String sessionId, Supplier<T> action) {
        LockEntry entry = locks.compute(sessionId, (k, existing) -> {
            LockEntry e = existing != null ? existing : new LockEntry();
            e.users++;
            return e;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(sessionId, (k, e) -> --e.users == 0 ? null : e);
        }
    }

    int size() {
        return locks.size();
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int users;
    }
}
