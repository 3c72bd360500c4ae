package com.starksync.sync.l1;

import com.starksync.sync.config.L1Network;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolved addresses of the watched contracts for one network, and the block
 * below which none of them emitted anything.
 */
public final class ContractDirectory {

    private final L1Network network;
    private final long deploymentBlock;
    private final Map<String, WatchedContract> byAddress = new LinkedHashMap<>();
    private final Map<WatchedContract, String> byContract = new EnumMap<>(WatchedContract.class);

    public ContractDirectory(L1Network network, long deploymentBlock, Map<WatchedContract, String> addresses) {
        this.network = network;
        this.deploymentBlock = deploymentBlock;
        for (WatchedContract contract : WatchedContract.values()) {
            String address = addresses.get(contract);
            if (address == null || address.isBlank()) {
                throw new IllegalArgumentException("No address for watched contract " + contract);
            }
            String normalized = address.toLowerCase(Locale.ROOT);
            byAddress.put(normalized, contract);
            byContract.put(contract, normalized);
        }
    }

    public Optional<WatchedContract> resolve(String address) {
        return Optional.ofNullable(byAddress.get(address.toLowerCase(Locale.ROOT)));
    }

    public String addressOf(WatchedContract contract) {
        return byContract.get(contract);
    }

    public List<String> addresses() {
        return List.copyOf(byAddress.keySet());
    }

    /**
     * Topic filter matching any of the watched events in position 0.
     */
    public List<List<Hash32>> topics() {
        return List.of(Arrays.stream(WatchedContract.values()).map(WatchedContract::getTopic).toList());
    }

    public LogFilter window(long fromBlock, long toBlock) {
        return new LogFilter(fromBlock, toBlock, addresses(), topics());
    }

    public LogFilter from(long fromBlock) {
        return new LogFilter(fromBlock, null, addresses(), topics());
    }

    public L1Network getNetwork() {
        return network;
    }

    public long getDeploymentBlock() {
        return deploymentBlock;
    }

    public Map<WatchedContract, String> asMap() {
        return Collections.unmodifiableMap(byContract);
    }

    @Override
    public String toString() {
        return "ContractDirectory{network=" + network + ", deploymentBlock=" + deploymentBlock
                + ", contracts=" + byContract + "}";
    }
}
