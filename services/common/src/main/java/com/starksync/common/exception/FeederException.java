package com.starksync.common.exception;

/**
 * Exception thrown when the StarkNet feeder gateway cannot serve a request.
 */
public class FeederException extends StarkSyncException {

    private final String operation;

    public FeederException(String operation, String message) {
        this(operation, message, null);
    }

    public FeederException(String operation, String message, Throwable cause) {
        super(SyncErrorCode.FEEDER_REQUEST_FAILED, String.format("%s (operation=%s)", message, operation), true, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
