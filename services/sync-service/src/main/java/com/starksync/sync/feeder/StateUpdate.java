package com.starksync.sync.feeder;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

public record StateUpdate(
        @JsonProperty("block_hash") String blockHash,
        @JsonProperty("block_number") long blockNumber,
        @JsonProperty("new_root") BigInteger newRoot,
        @JsonProperty("old_root") BigInteger oldRoot,
        @JsonProperty("state_diff") StateDiff stateDiff
) {

    public StateUpdate {
        stateDiff = stateDiff == null ? StateDiff.empty() : stateDiff;
    }
}
