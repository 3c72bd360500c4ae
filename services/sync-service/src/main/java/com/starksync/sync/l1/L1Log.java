package com.starksync.sync.l1;

import java.util.List;
import java.util.Locale;

/**
 * A contract log as returned by the Ethereum node.
 *
 * @param address     emitting contract, hex
 * @param topics      indexed topics, event signature first
 * @param data        ABI-encoded non-indexed fields
 * @param removed     true when the log was reverted by a chain reorganisation
 */
public record L1Log(
        String address,
        List<Hash32> topics,
        byte[] data,
        long blockNumber,
        Hash32 blockHash,
        Hash32 transactionHash,
        long logIndex,
        boolean removed
) {

    public L1Log {
        address = address.toLowerCase(Locale.ROOT);
        topics = List.copyOf(topics);
        data = data == null ? new byte[0] : data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    /**
     * True if this log sits strictly after the given chain position.
     */
    public boolean isAfter(long otherBlock, long otherLogIndex) {
        return blockNumber > otherBlock || (blockNumber == otherBlock && logIndex > otherLogIndex);
    }
}
