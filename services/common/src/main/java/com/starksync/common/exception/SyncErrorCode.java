package com.starksync.common.exception;

/**
 * Error codes for the StarkSync services
 * Format: MODULE_NNN
 */
public enum SyncErrorCode {

    // ===== L1 TRANSPORT ERRORS (L1_XXX) =====
    L1_TRANSPORT_FAILED("L1_001", "Ethereum node request failed"),
    L1_SUBSCRIPTION_FAILED("L1_002", "Ethereum log subscription failed"),
    L1_TRANSACTION_NOT_FOUND("L1_003", "Ethereum transaction not found"),

    // ===== EVENT DECODING ERRORS (DECODE_XXX) =====
    DECODE_MALFORMED_EVENT("DECODE_001", "Malformed event payload"),
    DECODE_UNEXPECTED_FIELD("DECODE_002", "Unexpected or missing event field"),

    // ===== COMMITMENT ERRORS (COMMIT_XXX) =====
    COMMIT_INPUT_OUT_OF_RANGE("COMMIT_001", "Field element is outside the STARK field"),
    COMMIT_UNHASHABLE_INPUT("COMMIT_002", "Unhashable input for Pedersen hash"),
    COMMIT_UNKNOWN_CONTRACT_HASH("COMMIT_003", "Contract hash is unknown for contract"),

    // ===== PERSISTENCE ERRORS (STORE_XXX) =====
    STORE_WRITE_FAILED("STORE_001", "Key-value write failed"),
    STORE_READ_FAILED("STORE_002", "Key-value read failed"),
    STORE_CORRUPTED_VALUE("STORE_003", "Stored value is corrupted"),

    // ===== FEEDER GATEWAY ERRORS (FEEDER_XXX) =====
    FEEDER_REQUEST_FAILED("FEEDER_001", "Feeder gateway request failed");

    private final String code;
    private final String defaultMessage;

    SyncErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
