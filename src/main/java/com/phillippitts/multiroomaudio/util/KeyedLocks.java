package com.phillippitts.multiroomaudio.util;

import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One reentrant lock per key, so work on the same player is serialized while different
 * players proceed in parallel.
 *
 * <p>An entry exists only while some thread holds or waits for its lock: callers register in
 * the map before locking and deregister after unlocking, and the entry is dropped when the last
 * one leaves. Lookups of arbitrary (e.g. unknown) names therefore leave nothing behind.
 */
public final class KeyedLocks {

    private final ConcurrentMap<String, Entry> locks = new ConcurrentHashMap<>();

    /** Lock plus the number of threads holding or waiting for it; guarded by the map's per-key atomicity. */
    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }

    public <T> T withLock(String key, Supplier<T> action) {
        Entry entry = locks.compute(key, (k, existing) -> {
            Entry e = existing == null ? new Entry() : existing;
            e.users++;
            return e;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
        }
    }

    /**
     * Runs {@code action} holding the locks of both keys, acquired in natural order to avoid
     * lock-order deadlocks between two renames in opposite directions.
     */
    public <T> T withLocks(String first, String second, Supplier<T> action) {
        TreeSet<String> ordered = new TreeSet<>();
        ordered.add(first);
        ordered.add(second);
        if (ordered.size() == 1) {
            return withLock(first, action);
        }
        String low = ordered.first();
        String high = ordered.last();
        return withLock(low, () -> withLock(high, action));
    }

    /** Visible for tests */
    boolean isLocked(String key) {
        Entry entry = locks.get(key);
        return entry != null && entry.lock.isLocked();
    }

    /** Visible for tests */
    int size() {
        return locks.size();
    }
}
