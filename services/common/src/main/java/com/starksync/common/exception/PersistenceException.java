package com.starksync.common.exception;

/**
 * Exception thrown when the key-value store rejects a read or write.
 *
 * Retryable, except for corrupted values. Checkpoints must not advance until
 * the underlying write is confirmed.
 */
public class PersistenceException extends StarkSyncException {

    private final String key;

    public PersistenceException(SyncErrorCode errorCode, String key, String message) {
        this(errorCode, key, message, null);
    }

    public PersistenceException(SyncErrorCode errorCode, String key, String message, Throwable cause) {
        super(errorCode, String.format("%s (key=%s)", message, key),
                errorCode != SyncErrorCode.STORE_CORRUPTED_VALUE, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
