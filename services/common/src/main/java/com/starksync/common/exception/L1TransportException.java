package com.starksync.common.exception;

/**
 * Exception thrown when a request to the Ethereum node fails.
 *
 * Common causes:
 * - Node is down or unreachable
 * - RPC endpoint rejected a log filter (range too large, rate limited)
 * - Log subscription was dropped by the node
 *
 * Always retryable. Callers retry with backoff and must leave in-memory
 * queues untouched when the request ultimately fails.
 */
public class L1TransportException extends StarkSyncException {

    private final String operation;

    public L1TransportException(String operation, String message) {
        this(SyncErrorCode.L1_TRANSPORT_FAILED, operation, message, null);
    }

    public L1TransportException(String operation, String message, Throwable cause) {
        this(SyncErrorCode.L1_TRANSPORT_FAILED, operation, message, cause);
    }

    public L1TransportException(SyncErrorCode errorCode, String operation, String message, Throwable cause) {
        super(errorCode, String.format("%s (operation=%s)", message, operation), true, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
