package com.starksync.sync.l1;

/**
 * An L1 transaction. Its input data carries the encoded memory page.
 */
public record L1Transaction(Hash32 hash, long blockNumber, byte[] input) {

    public L1Transaction {
        input = input == null ? new byte[0] : input.clone();
    }

    @Override
    public byte[] input() {
        return input.clone();
    }
}
