package com.starksync.common.exception;

/**
 * Exception thrown when a Pedersen commitment cannot be computed.
 *
 * Not retryable. A contract whose commitment fails cannot be written to the
 * state tree, so the whole block's materialization is aborted.
 */
public class CommitmentException extends StarkSyncException {

    public CommitmentException(SyncErrorCode errorCode, String message) {
        super(errorCode, message, false);
    }

    public CommitmentException(SyncErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, false, cause);
    }
}
