package com.procrawl.listingsync.ingest.service;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped locks keyed by identity key. Two keys may share a stripe; one key always maps to
 * the same stripe, so read-then-write for a key never interleaves within this process.
 */
public class KeyLocks {
    private final ReentrantLock[] stripes;

    public KeyLocks(int stripeCount) {
        this.stripes = new ReentrantLock[Math.max(1, stripeCount)];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
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

    int stripeCount() {
        return stripes.length;
    }

    private ReentrantLock lockFor(String key) {
        int hash = key == null ? 0 : key.hashCode();
        hash ^= (hash >>> 16);
        return stripes[Math.floorMod(hash, stripes.length)];
    }
}
