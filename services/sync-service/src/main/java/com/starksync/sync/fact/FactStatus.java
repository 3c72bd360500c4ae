package com.starksync.sync.fact;

/**
 * Lifecycle of a fact within one run.
 */
public enum FactStatus {
    OBSERVED,
    PAGES_KNOWN,
    RESOLVING,
    RESOLVED
}
