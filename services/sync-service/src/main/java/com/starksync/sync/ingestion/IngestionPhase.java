package com.starksync.sync.ingestion;

public enum IngestionPhase {
    IDLE,
    BACKFILL,
    LIVE_TAIL,
    STOPPED,
    FAILED
}
