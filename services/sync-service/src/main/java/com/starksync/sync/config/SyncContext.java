package com.starksync.sync.config;

import com.starksync.common.storage.KeyValueStore;
import com.starksync.sync.feeder.FeederClient;
import com.starksync.sync.l1.L1Client;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Collaborators shared by the sync components, built once at startup.
 * Closing the context releases the L1 connection.
 */
@Slf4j
@Getter
public class SyncContext implements AutoCloseable {

    private final L1Client l1Client;
    private final FeederClient feederClient;
    private final KeyValueStore keyValueStore;
    private final SyncProperties properties;

    public SyncContext(L1Client l1Client,
                       FeederClient feederClient,
                       KeyValueStore keyValueStore,
                       SyncProperties properties) {
        this.l1Client = Objects.requireNonNull(l1Client, "l1Client");
        this.feederClient = Objects.requireNonNull(feederClient, "feederClient");
        this.keyValueStore = Objects.requireNonNull(keyValueStore, "keyValueStore");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @Override
    public void close() {
        try {
            l1Client.close();
            log.info("L1 client released");
        } catch (RuntimeException e) {
            log.warn("Failed to close L1 client: error={}", e.getMessage(), e);
        }
    }
}
