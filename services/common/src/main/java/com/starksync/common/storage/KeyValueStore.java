package com.starksync.common.storage;

import com.starksync.common.exception.PersistenceException;

import java.util.Optional;

/**
 * Byte-oriented key-value storage engine.
 *
 * <p>Implementations signal failures with {@link PersistenceException}. A
 * {@code put} that returns normally is durable.
 */
public interface KeyValueStore {

    Optional<byte[]> get(byte[] key);

    void put(byte[] key, byte[] value);

    /**
     * Removes the key. Deleting an absent key is a no-op.
     */
    void delete(byte[] key);
}
