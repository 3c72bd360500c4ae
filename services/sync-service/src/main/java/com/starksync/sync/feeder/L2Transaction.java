package com.starksync.sync.feeder;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record L2Transaction(
        @JsonProperty("transaction_hash") String transactionHash,
        String type,
        @JsonProperty("contract_address") String contractAddress,
        @JsonProperty("entry_point_selector") String entryPointSelector,
        List<String> calldata
) {

    public L2Transaction {
        calldata = calldata == null ? List.of() : List.copyOf(calldata);
    }
}
