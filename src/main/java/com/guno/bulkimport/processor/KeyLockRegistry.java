package com.guno.bulkimport.processor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Key Lock Registry - in-process exclusive locks on external identifiers and natural values.
 * Keys are always taken in sorted order so two rows can never wait on each other.
 * An entry lives only while some row holds or waits for its key.
 */
@Component
@Slf4j
public class KeyLockRegistry {

    private final ConcurrentMap<String, KeyLock> locks = new ConcurrentHashMap<>();

    public static String key(String entityType, String scope, String value) {
        return entityType + "|" + scope + "|" + value;
    }

    public Held acquire(Collection<String> keys) {
        Deque<String> held = new ArrayDeque<>();
        for (String key : new TreeSet<>(keys)) {
            KeyLock lock = locks.compute(key, (k, existing) -> {
                KeyLock entry = existing == null ? new KeyLock() : existing;
                entry.users++;
                return entry;
            });
            lock.lock.lock();
            held.push(key);
        }
        if (!held.isEmpty()) {
            log.trace("Holding {} key lock(s)", held.size());
        }
        return new Held(held);
    }

    private void release(String key) {
        locks.compute(key, (k, entry) -> {
            entry.lock.unlock();
            entry.users--;
            return entry.users == 0 ? null : entry;
        });
    }

    int size() {
        return locks.size();
    }

    private static class KeyLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

    /**
     * Locks taken by one row, released in reverse order
     */
    public class Held implements AutoCloseable {

        private final Deque<String> keys;

        private Held(Deque<String> keys) {
            this.keys = keys;
        }

        public int count() {
            return keys.size();
        }

        @Override
        public void close() {
            while (!keys.isEmpty()) {
                release(keys.pop());
            }
        }
    }
}
