package com.helia.service.impl;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One mutual-exclusion scope per session id. Entries are weakly held and disappear once no
 * thread references the lock.
 */
@Component
public class SessionLocks {

    private final Cache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build();

    public <T> T withLock(String sessionId, Supplier<T> action) {
        ReentrantLock lock = locks.get(sessionId, key -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runLocked(String sessionId, Runnable action) {
        withLock(sessionId, () -> {
            action.run();
            return null;
        });
    }
}
