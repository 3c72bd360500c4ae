package com.starksync.common.concurrent;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Thread-safe utilities for the sync workers
 */
@Slf4j
public final class ConcurrencyUtils {

    private ConcurrencyUtils() {
    }

    /**
     * Executes an action with a lock
     */
    public static <T> T withLock(Lock lock, Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Executes an action with a lock (void return)
     */
    public static void withLockVoid(Lock lock, Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Creates a single-threaded executor whose worker carries the given name
     */
    public static ExecutorService namedSingleThreadExecutor(String threadName) {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(false);
            return t;
        });
    }

    /**
     * Shuts an executor down, letting in-flight work drain for up to the timeout
     * before interrupting it.
     *
     * @return true if the executor drained on its own
     */
    public static boolean shutdownGracefully(ExecutorService executor, Duration timeout) {
        executor.shutdown();
        try {
            if (executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            log.warn("Executor did not drain within {} ms, interrupting workers", timeout.toMillis());
            executor.shutdownNow();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        return false;
    }
}
