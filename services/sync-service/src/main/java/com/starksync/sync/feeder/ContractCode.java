package com.starksync.sync.feeder;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Compiled contract code and its ABI, as served by the feeder.
 */
public record ContractCode(List<String> bytecode, JsonNode abi) {

    public ContractCode {
        bytecode = bytecode == null ? List.of() : List.copyOf(bytecode);
    }
}
