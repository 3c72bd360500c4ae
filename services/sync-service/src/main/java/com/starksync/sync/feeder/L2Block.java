package com.starksync.sync.feeder;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record L2Block(
        @JsonProperty("block_hash") String blockHash,
        @JsonProperty("block_number") long blockNumber,
        @JsonProperty("parent_block_hash") String parentBlockHash,
        @JsonProperty("state_root") String stateRoot,
        String status,
        long timestamp,
        @JsonProperty("transaction_hashes") List<String> transactionHashes
) {

    public L2Block {
        transactionHashes = transactionHashes == null ? List.of() : List.copyOf(transactionHashes);
    }
}
