package com.starksync.common.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception for all StarkSync failures.
 *
 * Carries an error code, whether the failed operation may be retried, and
 * metadata (hashes, addresses, heights) that is rendered into log lines.
 */
@Getter
public class StarkSyncException extends RuntimeException {

    private final SyncErrorCode errorCode;
    private final boolean retryable;
    private final Map<String, Object> metadata;

    public StarkSyncException(SyncErrorCode errorCode, String message, boolean retryable) {
        this(errorCode, message, retryable, null);
    }

    public StarkSyncException(SyncErrorCode errorCode, String message, boolean retryable, Throwable cause) {
        super(buildMessage(errorCode, message), cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
        this.metadata = new LinkedHashMap<>();
    }

    /**
     * Add metadata to the exception
     */
    public StarkSyncException withMetadata(String key, Object value) {
        this.metadata.put(key, value);
        return this;
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    private static String buildMessage(SyncErrorCode errorCode, String message) {
        String text = message != null ? message : errorCode.getDefaultMessage();
        return String.format("[%s] %s", errorCode.getCode(), text);
    }
}
