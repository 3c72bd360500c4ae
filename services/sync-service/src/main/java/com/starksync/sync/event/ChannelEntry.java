package com.starksync.sync.event;

/**
 * Anything carried on the ingestion channel, in chain order.
 */
public interface ChannelEntry {

    long blockNumber();
}
