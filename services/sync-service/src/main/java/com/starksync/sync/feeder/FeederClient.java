package com.starksync.sync.feeder;

import com.starksync.common.exception.FeederException;

import java.util.Optional;

/**
 * StarkNet feeder gateway. Every call may fail with {@link FeederException}.
 */
public interface FeederClient {

    ContractAddresses getContractAddresses();

    /**
     * State update of an L2 block, or empty if the block does not exist yet.
     */
    Optional<StateUpdate> getStateUpdate(long blockNumber);

    ContractCode getCode(String contractAddress, String blockHash);

    L2Block getBlock(long blockNumber);

    L2Transaction getTransaction(String transactionHash);
}
