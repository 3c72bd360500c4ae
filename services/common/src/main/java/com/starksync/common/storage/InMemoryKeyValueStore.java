package com.starksync.common.storage;

import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Volatile {@link KeyValueStore}. Keys are ordered lexicographically as unsigned bytes.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final ConcurrentSkipListMap<byte[], byte[]> entries =
            new ConcurrentSkipListMap<>(Arrays::compareUnsigned);

    @Override
    public Optional<byte[]> get(byte[] key) {
        byte[] value = entries.get(key);
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    @Override
    public void put(byte[] key, byte[] value) {
        entries.put(key.clone(), value.clone());
    }

    @Override
    public void delete(byte[] key) {
        entries.remove(key);
    }

    public int size() {
        return entries.size();
    }
}
