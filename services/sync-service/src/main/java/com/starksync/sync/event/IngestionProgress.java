package com.starksync.sync.event;

/**
 * Marks that every watched log up to and including {@code blockNumber} is
 * ahead of this entry on the channel. Consumed to advance the ingestion
 * checkpoint once those events are applied.
 */
public record IngestionProgress(long blockNumber) implements ChannelEntry {
}
