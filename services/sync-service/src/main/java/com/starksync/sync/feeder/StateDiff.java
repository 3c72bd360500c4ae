package com.starksync.sync.feeder;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contracts deployed in a block and the storage writes per contract address, in order.
 */
public record StateDiff(
        @JsonProperty("deployed_contracts") List<DeployedContract> deployedContracts,
        @JsonProperty("storage_diffs") Map<String, List<StorageEntry>> storageDiffs
) {

    public StateDiff {
        deployedContracts = deployedContracts == null ? List.of() : List.copyOf(deployedContracts);
        Map<String, List<StorageEntry>> diffs = new LinkedHashMap<>();
        if (storageDiffs != null) {
            storageDiffs.forEach((address, entries) -> diffs.put(address, List.copyOf(entries)));
        }
        storageDiffs = Collections.unmodifiableMap(diffs);
    }

    public static StateDiff empty() {
        return new StateDiff(List.of(), Map.of());
    }
}
