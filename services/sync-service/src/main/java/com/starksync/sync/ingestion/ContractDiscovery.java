package com.starksync.sync.ingestion;

import com.starksync.sync.config.L1Network;
import com.starksync.sync.config.SyncContext;
import com.starksync.sync.config.SyncProperties;
import com.starksync.sync.l1.ContractDirectory;
import com.starksync.sync.l1.WatchedContract;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.util.EnumMap;
import java.util.Map;

/**
 * Works out which L1 contracts to watch: the network from the node's chain id,
 * the verifier and registry from the network defaults, and the state contract
 * from the feeder. Configured addresses take precedence.
 */
@Slf4j
public class ContractDiscovery {

    private final SyncContext context;

    public ContractDiscovery(SyncContext context) {
        this.context = context;
    }

    public ContractDirectory discover() {
        long chainId = context.getL1Client().chainId();
        L1Network network = L1Network.fromChainId(chainId);
        SyncProperties.NetworkProperties overrides = context.getProperties().getNetwork();

        Map<WatchedContract, String> addresses = new EnumMap<>(WatchedContract.class);
        addresses.put(WatchedContract.STATE, StringUtils.hasText(overrides.getStateContractAddress())
                ? overrides.getStateContractAddress()
                : context.getFeederClient().getContractAddresses().starknet());
        addresses.put(WatchedContract.GPS_VERIFIER, StringUtils.hasText(overrides.getGpsVerifierAddress())
                ? overrides.getGpsVerifierAddress()
                : network.getGpsVerifierAddress());
        addresses.put(WatchedContract.MEMORY_PAGE_REGISTRY,
                StringUtils.hasText(overrides.getMemoryPageRegistryAddress())
                        ? overrides.getMemoryPageRegistryAddress()
                        : network.getMemoryPageRegistryAddress());
        long deploymentBlock = overrides.getDeploymentBlock() != null
                ? overrides.getDeploymentBlock()
                : network.getDeploymentBlock();

        ContractDirectory directory = new ContractDirectory(network, deploymentBlock, addresses);
        log.info("Watching L1 contracts: chainId={}, {}", chainId, directory);
        return directory;
    }
}
