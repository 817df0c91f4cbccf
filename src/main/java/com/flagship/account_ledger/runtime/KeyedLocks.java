package com.flagship.account_ledger.runtime;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One mutual-exclusion slot per key. Work for the same key runs one at a time,
 * work for different keys runs in parallel. A slot is dropped once nobody holds
 * or waits for it, so the map only grows with the number of keys in flight.
 *
 * @param <K> key type
 */
public class KeyedLocks<K> {

    private final ConcurrentHashMap<K, Slot> slots = new ConcurrentHashMap<>();

    public <T> T withLock(K key, Supplier<T> action) {
        Slot slot = slots.compute(key, (k, existing) -> {
            Slot s = existing != null ? existing : new Slot();
            s.users++;
            return s;
        });

        slot.lock.lock();
        try {
            return action.get();
        } finally {
            slot.lock.unlock();
            slots.computeIfPresent(key, (k, s) -> --s.users == 0 ? null : s);
        }
    }

    /**
     * Number of keys currently held or waited for.
     */
    public int size() {
        return slots.size();
    }

    private static final class Slot {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int users;
    }
}
