package com.starksync.sync.l1;

import com.starksync.common.exception.L1TransportException;

import java.util.List;
import java.util.Optional;

/**
 * Ethereum node connection. Every call may fail with {@link L1TransportException}.
 */
public interface L1Client extends AutoCloseable {

    long chainId();

    long blockNumber();

    List<L1Log> filterLogs(LogFilter filter);

    /**
     * Opens a subscription delivering logs from {@code filter.fromBlock()} onwards.
     */
    LogSubscription subscribeFilterLogs(LogFilter filter);

    Optional<L1Transaction> transactionByHash(Hash32 hash);

    @Override
    void close();
}
