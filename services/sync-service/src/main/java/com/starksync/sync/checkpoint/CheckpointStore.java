package com.starksync.sync.checkpoint;

import com.starksync.common.concurrent.ConcurrencyUtils;
import com.starksync.common.exception.PersistenceException;
import com.starksync.common.exception.SyncErrorCode;
import com.starksync.common.storage.KeyValueStore;
import lombok.extern.slf4j.Slf4j;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Monotonic block-height checkpoint, stored as 8 big-endian bytes under a fixed key.
 *
 * <p>The cached height only moves after the store confirmed the write, and a
 * height lower than the stored one is never written.
 */
@Slf4j
public class CheckpointStore {

    /** Last L1 block whose logs were fully emitted by the ingestion pipeline. */
    public static final String L1_INGESTION_KEY = "latestL1BlockIngested";

    /** Last L2 block whose state was fully committed. */
    public static final String L2_SYNC_KEY = "latestBlockSynced";

    private final KeyValueStore store;
    private final String key;
    private final byte[] keyBytes;
    private final Lock lock = new ReentrantLock();

    private boolean loaded;
    private Long cached;

    public CheckpointStore(KeyValueStore store, String key) {
        this.store = store;
        this.key = key;
        this.keyBytes = key.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * The stored height, or empty on a cold start.
     */
    public OptionalLong find() {
        return ConcurrencyUtils.withLock(lock, () -> {
            Long height = current();
            return height == null ? OptionalLong.empty() : OptionalLong.of(height);
        });
    }

    /**
     * The stored height, or 0 on a cold start.
     */
    public long load() {
        return find().orElse(0L);
    }

    /**
     * Persists the height.
     *
     * @return true if the stored height changed
     * @throws PersistenceException if the write failed; the checkpoint is then unchanged
     */
    public boolean save(long height) {
        if (height < 0) {
            throw new IllegalArgumentException("Negative checkpoint height: " + height);
        }
        return ConcurrencyUtils.withLock(lock, () -> {
            Long stored = current();
            if (stored != null && height <= stored) {
                if (height < stored) {
                    log.warn("Ignoring checkpoint regression: key={}, stored={}, offered={}", key, stored, height);
                }
                return false;
            }
            try {
                store.put(keyBytes, ByteBuffer.allocate(Long.BYTES).putLong(height).array());
            } catch (PersistenceException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new PersistenceException(SyncErrorCode.STORE_WRITE_FAILED, key,
                        "Checkpoint write failed at height " + height, e);
            }
            cached = height;
            log.debug("Checkpoint saved: key={}, height={}", key, height);
            return true;
        });
    }

    public String getKey() {
        return key;
    }

    private Long current() {
        if (!loaded) {
            cached = read().orElse(null);
            loaded = true;
        }
        return cached;
    }

    private Optional<Long> read() {
        Optional<byte[]> raw;
        try {
            raw = store.get(keyBytes);
        } catch (PersistenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PersistenceException(SyncErrorCode.STORE_READ_FAILED, key, "Checkpoint read failed", e);
        }
        return raw.map(bytes -> {
            if (bytes.length != Long.BYTES) {
                throw new PersistenceException(SyncErrorCode.STORE_CORRUPTED_VALUE, key,
                        "Checkpoint must be 8 bytes, found " + bytes.length);
            }
            return ByteBuffer.wrap(bytes).getLong();
        });
    }
}
