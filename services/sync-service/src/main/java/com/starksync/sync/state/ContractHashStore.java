package com.starksync.sync.state;

import com.starksync.common.crypto.FieldElements;
import com.starksync.common.exception.PersistenceException;
import com.starksync.common.exception.SyncErrorCode;
import com.starksync.common.storage.KeyValueStore;
import com.starksync.common.storage.PrefixedKeyValueStore;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Contract address to class hash, as 32 big-endian bytes.
 */
public class ContractHashStore {

    static final String PREFIX = "contract_hash";

    private final PrefixedKeyValueStore store;

    public ContractHashStore(KeyValueStore engine) {
        this.store = new PrefixedKeyValueStore(engine, PREFIX);
    }

    public void store(String contractAddress, BigInteger contractHash) {
        store.put(key(contractAddress), FieldElements.toBytes32(contractHash));
    }

    public Optional<BigInteger> find(String contractAddress) {
        String key = key(contractAddress);
        return store.get(key).map(bytes -> {
            if (bytes.length != 32) {
                throw new PersistenceException(SyncErrorCode.STORE_CORRUPTED_VALUE, PREFIX + ":" + key,
                        "Contract hash must be 32 bytes, found " + bytes.length);
            }
            return FieldElements.fromBytes(bytes);
        });
    }

    private static String key(String contractAddress) {
        return FieldElements.toHex(FieldElements.fromHex(contractAddress));
    }
}
