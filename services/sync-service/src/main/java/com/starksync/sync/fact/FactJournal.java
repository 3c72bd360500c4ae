package com.starksync.sync.fact;

import com.starksync.common.exception.PersistenceException;
import com.starksync.common.exception.SyncErrorCode;
import com.starksync.common.storage.KeyValueStore;
import com.starksync.common.storage.PrefixedKeyValueStore;
import com.starksync.sync.l1.Hash32;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Durable side of the {@link FactRegistry}: page sets, page transactions, the
 * pending queue and resolved-fact markers, each under its own key prefix.
 *
 * <p>Page sets and page transactions are write-once; a conflicting second
 * record keeps the stored value. Hash lists are stored as concatenated
 * 32-byte words.
 */
@Slf4j
public class FactJournal {

    static final String PAGES_PREFIX = "fact_pages";
    static final String TRANSACTION_PREFIX = "page_transaction";
    static final String RESOLVED_PREFIX = "fact_resolved";
    static final String QUEUE_PREFIX = "fact_queue";
    static final String QUEUE_KEY = "pending";

    private static final byte[] RESOLVED_MARKER = {1};

    private final PrefixedKeyValueStore pages;
    private final PrefixedKeyValueStore transactions;
    private final PrefixedKeyValueStore resolved;
    private final PrefixedKeyValueStore queue;

    public FactJournal(KeyValueStore engine) {
        this.pages = new PrefixedKeyValueStore(engine, PAGES_PREFIX);
        this.transactions = new PrefixedKeyValueStore(engine, TRANSACTION_PREFIX);
        this.resolved = new PrefixedKeyValueStore(engine, RESOLVED_PREFIX);
        this.queue = new PrefixedKeyValueStore(engine, QUEUE_PREFIX);
    }

    /**
     * @return true if stored, false if the fact already had a page set
     */
    public boolean recordPages(Hash32 factHash, List<Hash32> pageHashes) {
        String key = factHash.toHex();
        Optional<List<Hash32>> existing = findPages(factHash);
        if (existing.isPresent()) {
            if (!existing.get().equals(pageHashes)) {
                log.warn("Ignoring conflicting page set: fact={}, recorded={}, offered={}",
                        factHash, existing.get().size(), pageHashes.size());
            }
            return false;
        }
        pages.put(key, encode(pageHashes));
        return true;
    }

    public Optional<List<Hash32>> findPages(Hash32 factHash) {
        String key = factHash.toHex();
        return pages.get(key).map(bytes -> decode(PAGES_PREFIX, key, bytes));
    }

    /**
     * @return true if stored, false if the page already had a transaction
     */
    public boolean recordTransaction(Hash32 pageHash, Hash32 transactionHash) {
        Optional<Hash32> existing = findTransaction(pageHash);
        if (existing.isPresent()) {
            if (!existing.get().equals(transactionHash)) {
                log.warn("Ignoring conflicting page transaction: page={}, recorded={}, offered={}",
                        pageHash, existing.get(), transactionHash);
            }
            return false;
        }
        transactions.put(pageHash.toHex(), transactionHash.toBytes());
        return true;
    }

    public Optional<Hash32> findTransaction(Hash32 pageHash) {
        String key = pageHash.toHex();
        return transactions.get(key).map(bytes -> {
            if (bytes.length != Hash32.LENGTH) {
                throw new PersistenceException(SyncErrorCode.STORE_CORRUPTED_VALUE, TRANSACTION_PREFIX + ":" + key,
                        "Transaction hash must be 32 bytes, found " + bytes.length);
            }
            return Hash32.of(bytes);
        });
    }

    public List<Hash32> loadQueue() {
        return queue.get(QUEUE_KEY)
                .map(bytes -> decode(QUEUE_PREFIX, QUEUE_KEY, bytes))
                .orElse(List.of());
    }

    public void saveQueue(List<Hash32> facts) {
        queue.put(QUEUE_KEY, encode(facts));
    }

    public boolean isResolved(Hash32 factHash) {
        return resolved.get(factHash.toHex()).isPresent();
    }

    /**
     * Marks the fact resolved, drops it from the stored queue and discards its page set.
     * Page transactions stay, since another fact may reference the same page.
     */
    public void markResolved(Hash32 factHash, List<Hash32> remainingQueue) {
        resolved.put(factHash.toHex(), RESOLVED_MARKER);
        saveQueue(remainingQueue);
        pages.delete(factHash.toHex());
    }

    private static byte[] encode(List<Hash32> hashes) {
        byte[] out = new byte[hashes.size() * Hash32.LENGTH];
        for (int i = 0; i < hashes.size(); i++) {
            System.arraycopy(hashes.get(i).toBytes(), 0, out, i * Hash32.LENGTH, Hash32.LENGTH);
        }
        return out;
    }

    private static List<Hash32> decode(String prefix, String key, byte[] bytes) {
        if (bytes.length % Hash32.LENGTH != 0) {
            throw new PersistenceException(SyncErrorCode.STORE_CORRUPTED_VALUE, prefix + ":" + key,
                    "Hash list length " + bytes.length + " is not a multiple of 32");
        }
        List<Hash32> hashes = new ArrayList<>(bytes.length / Hash32.LENGTH);
        for (int offset = 0; offset < bytes.length; offset += Hash32.LENGTH) {
            hashes.add(Hash32.of(Arrays.copyOfRange(bytes, offset, offset + Hash32.LENGTH)));
        }
        return List.copyOf(hashes);
    }
}
