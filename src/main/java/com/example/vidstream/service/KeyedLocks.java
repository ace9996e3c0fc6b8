package com.example.vidstream.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process mutual exclusion per (video, profile) key, shared by every writer of a key: enqueue, the catalog
 * and purge. Lock objects are kept for the lifetime of the process; the key space is bounded by videos times profiles.
 */
@Component
public class KeyedLocks {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public static String key(Long videoId, String profileName) {
        return videoId + "/" + profileName;
    }

    public <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runWithLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Holds every lock of {@code keys} while running the action. Keys must always be passed in the same
     * order (profile order) so two multi-key holders cannot deadlock.
     */
    public void runWithLocks(List<String> keys, Runnable action) {
        List<ReentrantLock> held = new ArrayList<>(keys.size());
        try {
            for (String key : keys) {
                ReentrantLock lock = lockFor(key);
                lock.lock();
                held.add(lock);
            }
            action.run();
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                held.get(i).unlock();
            }
        }
    }

    private ReentrantLock lockFor(String key) {
        return locks.computeIfAbsent(key, k -> new ReentrantLock());
    }
}
