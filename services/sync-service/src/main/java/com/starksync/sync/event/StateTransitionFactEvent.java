package com.starksync.sync.event;

import com.starksync.sync.l1.Hash32;
import com.starksync.sync.l1.WatchedContract;

/**
 * The state contract accepted a state transition attested by {@code factHash}.
 */
public record StateTransitionFactEvent(Hash32 factHash, long blockNumber, long logIndex) implements L1Event {

    @Override
    public WatchedContract source() {
        return WatchedContract.STATE;
    }
}
