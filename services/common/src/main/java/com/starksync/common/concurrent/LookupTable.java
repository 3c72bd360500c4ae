package com.starksync.common.concurrent;

import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutex-guarded, write-once map exposing {@code add}, {@code get},
 * {@code exists} and {@code remove}.
 *
 * <p>An entry is immutable once recorded: a second {@code add} for the same key
 * keeps the first value until the entry is removed. Several tables may share one lock so that a caller
 * holding that lock sees a consistent view across all of them.
 *
 * @param <K> key type
 * @param <V> value type
 */
@Slf4j
public class LookupTable<K, V> {

    private final String name;
    private final Lock lock;
    private final Map<K, V> entries = new HashMap<>();

    public LookupTable(String name) {
        this(name, new ReentrantLock());
    }

    public LookupTable(String name, Lock lock) {
        this.name = Objects.requireNonNull(name, "name");
        this.lock = Objects.requireNonNull(lock, "lock");
    }

    /**
     * Records a value for the key unless one is already present.
     *
     * @return true if the value was recorded, false if the key already had one
     */
    public boolean add(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        return ConcurrencyUtils.withLock(lock, () -> {
            V existing = entries.putIfAbsent(key, value);
            if (existing == null) {
                return true;
            }
            if (!existing.equals(value)) {
                log.warn("Ignoring conflicting entry: table={}, key={}, recorded={}, offered={}",
                        name, key, existing, value);
            }
            return false;
        });
    }

    public Optional<V> get(K key) {
        return ConcurrencyUtils.withLock(lock, () -> Optional.ofNullable(entries.get(key)));
    }

    public boolean exists(K key) {
        return ConcurrencyUtils.withLock(lock, () -> entries.containsKey(key));
    }

    /**
     * Drops the entry for the key.
     *
     * @return the value that was recorded, if any
     */
    public Optional<V> remove(K key) {
        return ConcurrencyUtils.withLock(lock, () -> Optional.ofNullable(entries.remove(key)));
    }

    public int size() {
        return ConcurrencyUtils.withLock(lock, entries::size);
    }

    public String getName() {
        return name;
    }
}
