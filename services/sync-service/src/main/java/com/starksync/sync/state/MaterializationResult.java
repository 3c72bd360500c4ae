package com.starksync.sync.state;

public enum MaterializationResult {
    /** State written and checkpoint advanced. */
    COMMITTED,
    /** Block already at or below the checkpoint; nothing written. */
    SKIPPED
}
