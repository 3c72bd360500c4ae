package com.starksync.sync.l1;

import java.util.List;

/**
 * Log query over a block range. A {@code null} upper bound follows the chain head.
 */
public record LogFilter(
        long fromBlock,
        Long toBlock,
        List<String> addresses,
        List<List<Hash32>> topics
) {

    public LogFilter {
        if (toBlock != null && toBlock < fromBlock) {
            throw new IllegalArgumentException("toBlock " + toBlock + " is before fromBlock " + fromBlock);
        }
        addresses = List.copyOf(addresses);
        topics = topics.stream().map(List::copyOf).toList();
    }

    public boolean isOpenEnded() {
        return toBlock == null;
    }
}
