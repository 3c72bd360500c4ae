package com.starksync.sync.l1;

import com.starksync.common.exception.L1TransportException;

import java.time.Duration;
import java.util.Optional;

/**
 * Live log feed. A broken subscription surfaces as an {@link L1TransportException}
 * from {@link #poll} and must be closed and re-opened by the caller.
 */
public interface LogSubscription extends AutoCloseable {

    /**
     * Waits up to {@code timeout} for the next log.
     *
     * @return the next log, or empty if none arrived in time
     */
    Optional<L1Log> poll(Duration timeout) throws InterruptedException;

    @Override
    void close();
}
