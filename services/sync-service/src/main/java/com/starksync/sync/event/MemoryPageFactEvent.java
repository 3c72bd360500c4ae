package com.starksync.sync.event;

import com.starksync.sync.l1.Hash32;
import com.starksync.sync.l1.WatchedContract;

import java.math.BigInteger;

/**
 * The memory page registry stored page {@code memoryHash}; its payload is the
 * input data of {@code transactionHash}.
 */
public record MemoryPageFactEvent(
        Hash32 factHash,
        Hash32 memoryHash,
        BigInteger prime,
        Hash32 transactionHash,
        long blockNumber,
        long logIndex
) implements L1Event {

    @Override
    public WatchedContract source() {
        return WatchedContract.MEMORY_PAGE_REGISTRY;
    }
}
