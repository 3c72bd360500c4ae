package com.starksync.sync.state;

import com.starksync.common.crypto.FieldElements;
import com.starksync.common.exception.CommitmentException;
import com.starksync.common.exception.SyncErrorCode;
import com.starksync.sync.checkpoint.CheckpointStore;
import com.starksync.sync.feeder.ContractCode;
import com.starksync.sync.feeder.DeployedContract;
import com.starksync.sync.feeder.FeederClient;
import com.starksync.sync.feeder.L2Block;
import com.starksync.sync.feeder.L2Transaction;
import com.starksync.sync.feeder.StateDiff;
import com.starksync.sync.feeder.StateUpdate;
import com.starksync.sync.feeder.StorageEntry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Applies one L2 state update to the local tries.
 *
 * <p>Order of writes for block {@code n}:
 * <ol>
 *   <li>block and transaction archive (optional)</li>
 *   <li>code and class hash of each deployed contract</li>
 *   <li>storage trie of each touched contract</li>
 *   <li>state trie leaves, only once every commitment was computed</li>
 *   <li>checkpoint at {@code n}</li>
 * </ol>
 * Every write is idempotent, so a crash anywhere before the checkpoint makes
 * the block safe to replay.
 */
@Slf4j
public class StateMaterializer {

    private final FeederClient feederClient;
    private final TrieFactory trieFactory;
    private final CodeStore codeStore;
    private final ContractHashStore contractHashStore;
    private final BlockArchive blockArchive;
    private final CheckpointStore checkpoint;
    private final boolean archiveBlocks;
    private final Counter materializedCounter;
    private final Counter contractsCounter;

    public StateMaterializer(FeederClient feederClient,
                             TrieFactory trieFactory,
                             CodeStore codeStore,
                             ContractHashStore contractHashStore,
                             BlockArchive blockArchive,
                             CheckpointStore checkpoint,
                             boolean archiveBlocks,
                             MeterRegistry meterRegistry) {
        this.feederClient = feederClient;
        this.trieFactory = trieFactory;
        this.codeStore = codeStore;
        this.contractHashStore = contractHashStore;
        this.blockArchive = blockArchive;
        this.checkpoint = checkpoint;
        this.archiveBlocks = archiveBlocks;
        this.materializedCounter = meterRegistry.counter("starksync.state.blocks.materialized");
        this.contractsCounter = meterRegistry.counter("starksync.state.contracts.committed");
    }

    public MaterializationResult materialize(StateUpdate update) {
        long blockNumber = update.blockNumber();
        OptionalLong synced = checkpoint.find();
        if (synced.isPresent() && blockNumber <= synced.getAsLong()) {
            log.debug("Skipping already materialized block={}, checkpoint={}", blockNumber, synced.getAsLong());
            return MaterializationResult.SKIPPED;
        }

        MDC.put("l2Block", Long.toString(blockNumber));
        try {
            if (archiveBlocks) {
                archive(blockNumber);
            }
            StateDiff diff = update.stateDiff();
            Map<String, BigInteger> deployed = storeDeployments(diff.deployedContracts(), update.blockHash());
            Map<String, BigInteger> commitments = computeCommitments(blockNumber, diff, deployed);

            StateTrie stateTrie = trieFactory.stateTrie();
            commitments.forEach((address, commitment) ->
                    stateTrie.put(FieldElements.fromHex(address), commitment));
            verifyRoot(update, stateTrie.root());

            checkpoint.save(blockNumber);
            materializedCounter.increment();
            contractsCounter.increment(commitments.size());
            log.info("Materialized block={}, deployed={}, contracts={}",
                    blockNumber, deployed.size(), commitments.size());
            return MaterializationResult.COMMITTED;
        } finally {
            MDC.remove("l2Block");
        }
    }

    public CheckpointStore getCheckpoint() {
        return checkpoint;
    }

    private void archive(long blockNumber) {
        L2Block block = feederClient.getBlock(blockNumber);
        List<L2Transaction> transactions = new ArrayList<>(block.transactionHashes().size());
        for (String hash : block.transactionHashes()) {
            transactions.add(feederClient.getTransaction(hash));
        }
        blockArchive.archive(block, transactions);
    }

    private Map<String, BigInteger> storeDeployments(List<DeployedContract> contracts, String blockHash) {
        Map<String, BigInteger> deployed = new LinkedHashMap<>();
        for (DeployedContract contract : contracts) {
            ContractCode code = feederClient.getCode(contract.address(), blockHash);
            codeStore.put(contract.address(), code);
            contractHashStore.store(contract.address(), contract.contractHash());
            deployed.put(normalize(contract.address()), contract.contractHash());
        }
        return deployed;
    }

    private Map<String, BigInteger> computeCommitments(long blockNumber,
                                                       StateDiff diff,
                                                       Map<String, BigInteger> deployed) {
        Set<String> touched = new LinkedHashSet<>(deployed.keySet());
        Map<String, List<StorageEntry>> writes = new LinkedHashMap<>();
        diff.storageDiffs().forEach((address, entries) -> {
            String key = normalize(address);
            touched.add(key);
            writes.computeIfAbsent(key, k -> new ArrayList<>()).addAll(entries);
        });

        Map<String, BigInteger> commitments = new LinkedHashMap<>();
        for (String address : touched) {
            StateTrie storage = trieFactory.storageTrie(address);
            for (StorageEntry entry : writes.getOrDefault(address, List.of())) {
                storage.put(entry.key(), entry.value());
            }
            BigInteger storageRoot = storage.root();
            BigInteger contractHash = deployed.containsKey(address)
                    ? deployed.get(address)
                    : contractHashStore.find(address).orElseThrow(() -> unknownHash(blockNumber, address));
            try {
                commitments.put(address, ContractStateCommitment.compute(contractHash, storageRoot));
            } catch (CommitmentException e) {
                e.withMetadata("block", blockNumber).withMetadata("contract", address);
                log.error("Commitment failed, aborting block: block={}, contract={}, error={}",
                        blockNumber, address, e.getMessage());
                throw e;
            }
        }
        return commitments;
    }

    private void verifyRoot(StateUpdate update, BigInteger root) {
        if (update.newRoot() != null && !update.newRoot().equals(root)) {
            log.warn("State root mismatch: block={}, expected={}, computed={}",
                    update.blockNumber(), FieldElements.toHex(update.newRoot()), FieldElements.toHex(root));
        }
    }

    private static CommitmentException unknownHash(long blockNumber, String address) {
        CommitmentException e = new CommitmentException(SyncErrorCode.COMMIT_UNKNOWN_CONTRACT_HASH,
                "No contract hash recorded for " + address + " at block " + blockNumber);
        e.withMetadata("block", blockNumber).withMetadata("contract", address);
        return e;
    }

    private static String normalize(String address) {
        return FieldElements.toHex(FieldElements.fromHex(address));
    }
}
