package com.chatwave.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per message id, created on demand and dropped when nobody holds or waits on it.
 * Work on different messages never contends.
 */
@Component
public class MessageLocks {

    private final Map<String, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String messageId, Supplier<T> action) {
        Entry entry = locks.compute(messageId, (id, current) -> {
            Entry e = current == null ? new Entry() : current;
            e.users++;
            return e;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(messageId, (id, current) -> --current.users == 0 ? null : current);
        }
    }

    /** Number of messages with a live lock entry. */
    int size() {
        return locks.size();
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int users;
    }
}
