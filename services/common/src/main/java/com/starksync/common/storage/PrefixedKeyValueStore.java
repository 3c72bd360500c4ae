package com.starksync.common.storage;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * View over a {@link KeyValueStore} that namespaces every key with a fixed prefix,
 * so several logical stores can share one storage engine.
 */
public class PrefixedKeyValueStore implements KeyValueStore {

    private final KeyValueStore delegate;
    private final byte[] prefix;

    public PrefixedKeyValueStore(KeyValueStore delegate, String prefix) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.prefix = (Objects.requireNonNull(prefix, "prefix") + ":").getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public Optional<byte[]> get(byte[] key) {
        return delegate.get(prefixed(key));
    }

    @Override
    public void put(byte[] key, byte[] value) {
        delegate.put(prefixed(key), value);
    }

    @Override
    public void delete(byte[] key) {
        delegate.delete(prefixed(key));
    }

    public Optional<byte[]> get(String key) {
        return get(key.getBytes(StandardCharsets.UTF_8));
    }

    public void put(String key, byte[] value) {
        put(key.getBytes(StandardCharsets.UTF_8), value);
    }

    public void delete(String key) {
        delete(key.getBytes(StandardCharsets.UTF_8));
    }

    private byte[] prefixed(byte[] key) {
        byte[] out = new byte[prefix.length + key.length];
        System.arraycopy(prefix, 0, out, 0, prefix.length);
        System.arraycopy(key, 0, out, prefix.length, key.length);
        return out;
    }
}
