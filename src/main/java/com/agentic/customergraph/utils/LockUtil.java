package com.agentic.customergraph.utils;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-customer locks. Work for one customer is serialised through its lock;
 * different customers never contend.
 */
public final class LockUtil {

    private static final ConcurrentHashMap<String, ReentrantLock> LOCK_POOL = new ConcurrentHashMap<>();

    private LockUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Gets the lock for a key. The same key always returns the same lock instance.
     */
    @NotNull
    public static ReentrantLock getLock(@NotNull String key) {
        return LOCK_POOL.computeIfAbsent(key, k -> new ReentrantLock(true));
    }

    @NotNull
    public static ReentrantLock customerLock(@NotNull String scope, @NotNull String customerId) {
        return getLock(scope + "::" + customerId);
    }

    /**
     * Clears the lock pool (useful for testing).
     */
    public static void clearLockPool() {
        LOCK_POOL.clear();
    }
}
