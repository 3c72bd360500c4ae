package com.starksync.sync.state;

public enum MaterializerStatus {
    RUNNING,
    HALTED
}
