package com.starksync.sync.event;

import com.starksync.sync.l1.WatchedContract;

/**
 * A decoded event from one of the watched contracts, positioned on the chain.
 */
public interface L1Event extends ChannelEntry {

    WatchedContract source();

    long logIndex();
}
