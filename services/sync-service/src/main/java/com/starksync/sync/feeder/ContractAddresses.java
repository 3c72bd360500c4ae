package com.starksync.sync.feeder;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ContractAddresses(
        @JsonProperty("Starknet") String starknet,
        @JsonProperty("GpsStatementVerifier") String gpsStatementVerifier
) {
}
