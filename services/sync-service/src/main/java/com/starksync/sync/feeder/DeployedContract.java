package com.starksync.sync.feeder;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

public record DeployedContract(
        String address,
        @JsonProperty("contract_hash") BigInteger contractHash
) {
}
