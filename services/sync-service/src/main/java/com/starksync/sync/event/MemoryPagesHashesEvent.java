package com.starksync.sync.event;

import com.starksync.sync.l1.Hash32;
import com.starksync.sync.l1.WatchedContract;

import java.util.List;

/**
 * The proof verifier published the ordered memory pages making up a fact.
 */
public record MemoryPagesHashesEvent(Hash32 factHash, List<Hash32> pagesHashes, long blockNumber, long logIndex)
        implements L1Event {

    public MemoryPagesHashesEvent {
        pagesHashes = List.copyOf(pagesHashes);
    }

    @Override
    public WatchedContract source() {
        return WatchedContract.GPS_VERIFIER;
    }
}
