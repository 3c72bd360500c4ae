package com.starksync.sync.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starksync.common.exception.PersistenceException;
import com.starksync.common.exception.SyncErrorCode;
import com.starksync.common.storage.KeyValueStore;
import com.starksync.common.storage.PrefixedKeyValueStore;
import com.starksync.sync.feeder.L2Block;
import com.starksync.sync.feeder.L2Transaction;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * JSON archive of L2 blocks by number and transactions by hash.
 */
@Slf4j
public class BlockArchive {

    private final PrefixedKeyValueStore blocks;
    private final PrefixedKeyValueStore transactions;
    private final ObjectMapper objectMapper;

    public BlockArchive(KeyValueStore engine, ObjectMapper objectMapper) {
        this.blocks = new PrefixedKeyValueStore(engine, "block");
        this.transactions = new PrefixedKeyValueStore(engine, "transaction");
        this.objectMapper = objectMapper;
    }

    public void archive(L2Block block, List<L2Transaction> blockTransactions) {
        for (L2Transaction transaction : blockTransactions) {
            write(transactions, transaction.transactionHash(), transaction);
        }
        write(blocks, Long.toString(block.blockNumber()), block);
        log.debug("Archived block={}, transactions={}", block.blockNumber(), blockTransactions.size());
    }

    public Optional<L2Block> findBlock(long blockNumber) {
        return read(blocks, Long.toString(blockNumber), L2Block.class);
    }

    public Optional<L2Transaction> findTransaction(String transactionHash) {
        return read(transactions, transactionHash, L2Transaction.class);
    }

    private void write(PrefixedKeyValueStore store, String key, Object value) {
        try {
            store.put(key, objectMapper.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw new PersistenceException(SyncErrorCode.STORE_WRITE_FAILED, key, "Cannot serialize archive entry", e);
        }
    }

    private <T> Optional<T> read(PrefixedKeyValueStore store, String key, Class<T> type) {
        Optional<byte[]> raw = store.get(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(raw.get(), type));
        } catch (IOException e) {
            throw new PersistenceException(SyncErrorCode.STORE_CORRUPTED_VALUE, key, "Cannot parse archive entry", e);
        }
    }
}
