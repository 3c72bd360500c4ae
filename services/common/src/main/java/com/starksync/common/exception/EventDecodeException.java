package com.starksync.common.exception;

/**
 * Exception thrown when an L1 log cannot be decoded into a typed event.
 *
 * Not retryable: the offending log is skipped and the pipeline continues.
 */
public class EventDecodeException extends StarkSyncException {

    private final String eventName;

    public EventDecodeException(SyncErrorCode errorCode, String eventName, String message) {
        this(errorCode, eventName, message, null);
    }

    public EventDecodeException(SyncErrorCode errorCode, String eventName, String message, Throwable cause) {
        super(errorCode, String.format("%s (event=%s)", message, eventName), false, cause);
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }
}
