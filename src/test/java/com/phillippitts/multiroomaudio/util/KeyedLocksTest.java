package com.phillippitts.multiroomaudio.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class KeyedLocksTest {

    private final KeyedLocks locks = new KeyedLocks();

    @Test
    void lockIsHeldOnlyDuringAction() {
        boolean heldInside = locks.withLock("Kitchen", () -> locks.isLocked("Kitchen"));

        assertThat(heldInside).isTrue();
        assertThat(locks.isLocked("Kitchen")).isFalse();
    }

    @Test
    void sameKeyIsSerialized() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            Future<?>[] futures = new Future<?>[8];
            for (int i = 0; i < futures.length; i++) {
                futures[i] = pool.submit(() -> locks.withLock("Kitchen", () -> {
                    maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                    sleep(5);
                    inside.decrementAndGet();
                    return null;
                }));
            }
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    void differentKeysDoNotBlockEachOther() throws Exception {
        CountDownLatch kitchenHeld = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            pool.submit(() -> locks.withLock("Kitchen", () -> {
                kitchenHeld.countDown();
                await(release);
                return null;
            }));
            assertThat(kitchenHeld.await(2, TimeUnit.SECONDS)).isTrue();

            assertThat(locks.withLock("Patio", () -> "done")).isEqualTo("done");
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void withLocksHoldsBothAndToleratesSameKey() {
        assertThat(locks.withLocks("Patio", "Kitchen",
                () -> locks.isLocked("Patio") && locks.isLocked("Kitchen"))).isTrue();
        assertThat(locks.withLocks("Kitchen", "Kitchen", () -> locks.isLocked("Kitchen"))).isTrue();
    }

    @Test
    void locksOfReleasedKeysAreDropped() {
        for (int i = 0; i < 10_000; i++) {
            locks.withLock("ghost-" + i, () -> null);
        }
        locks.withLocks("Patio", "Kitchen", () -> null);

        assertThat(locks.size()).isZero();
    }

    @Test
    void heldAndReentrantLocksStayTrackedUntilLastRelease() {
        locks.withLock("Kitchen", () -> {
            locks.withLock("Kitchen", () -> null);
            assertThat(locks.size()).isEqualTo(1);
            assertThat(locks.isLocked("Kitchen")).isTrue();
            return null;
        });

        assertThat(locks.size()).isZero();
    }

    @Test
    void waiterKeepsEntryAliveAfterHolderLeaves() throws Exception {
        CountDownLatch kitchenHeld = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger entered = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> holder = pool.submit(() -> locks.withLock("Kitchen", () -> {
                kitchenHeld.countDown();
                await(release);
                return null;
            }));
            assertThat(kitchenHeld.await(2, TimeUnit.SECONDS)).isTrue();
            Future<?> waiter = pool.submit(() -> locks.withLock("Kitchen", entered::incrementAndGet));

            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
            waiter.get(5, TimeUnit.SECONDS);
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
        assertThat(entered.get()).isEqualTo(1);
        assertThat(locks.size()).isZero();
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
