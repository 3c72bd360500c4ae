package com.starksync.sync.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starksync.common.crypto.FieldElements;
import com.starksync.common.exception.PersistenceException;
import com.starksync.common.exception.SyncErrorCode;
import com.starksync.common.storage.KeyValueStore;
import com.starksync.common.storage.PrefixedKeyValueStore;
import com.starksync.sync.feeder.ContractCode;

import java.io.IOException;
import java.util.Optional;

/**
 * Contract code by address, stored as JSON.
 */
public class CodeStore {

    static final String PREFIX = "code";

    private final PrefixedKeyValueStore store;
    private final ObjectMapper objectMapper;

    public CodeStore(KeyValueStore engine, ObjectMapper objectMapper) {
        this.store = new PrefixedKeyValueStore(engine, PREFIX);
        this.objectMapper = objectMapper;
    }

    public void put(String contractAddress, ContractCode code) {
        String key = key(contractAddress);
        try {
            store.put(key, objectMapper.writeValueAsBytes(code));
        } catch (JsonProcessingException e) {
            throw new PersistenceException(SyncErrorCode.STORE_WRITE_FAILED, key, "Cannot serialize contract code", e);
        }
    }

    public Optional<ContractCode> find(String contractAddress) {
        String key = key(contractAddress);
        Optional<byte[]> raw = store.get(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(raw.get(), ContractCode.class));
        } catch (IOException e) {
            throw new PersistenceException(SyncErrorCode.STORE_CORRUPTED_VALUE, key, "Cannot parse contract code", e);
        }
    }

    private static String key(String contractAddress) {
        return FieldElements.toHex(FieldElements.fromHex(contractAddress));
    }
}
