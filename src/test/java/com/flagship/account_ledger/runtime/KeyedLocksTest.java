package com.flagship.account_ledger.runtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class KeyedLocksTest {

    @Test
    @DisplayName("Work for the same key never overlaps")
    void testSameKey_Serialized() throws Exception {
        KeyedLocks<String> locks = new KeyedLocks<>();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                start.await();
                for (int j = 0; j < 100; j++) {
                    locks.withLock("a", () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        Thread.yield();
                        return inside.decrementAndGet();
                    });
                }
                return null;
            });
        }

        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));

        assertEquals(1, maxInside.get());
        assertEquals(0, locks.size());
    }

    @Test
    @DisplayName("Different keys do not block each other")
    void testDifferentKeys_Parallel() throws Exception {
        KeyedLocks<String> locks = new KeyedLocks<>();
        CountDownLatch bothInside = new CountDownLatch(2);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        for (String key : new String[] {"a", "b"}) {
            executor.submit(() -> locks.withLock(key, () -> {
                bothInside.countDown();
                try {
                    return bothInside.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }));
        }

        assertTrue(bothInside.await(10, TimeUnit.SECONDS), "second key was blocked by the first");
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("The slot is released when the action throws")
    void testReleasedOnException() {
        KeyedLocks<String> locks = new KeyedLocks<>();

        assertThrows(IllegalStateException.class, () -> locks.withLock("a", () -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals(0, locks.size());
        assertEquals("ok", locks.withLock("a", () -> "ok"));
    }
}
