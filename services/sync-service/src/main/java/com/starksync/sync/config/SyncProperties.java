package com.starksync.sync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "starksync")
public class SyncProperties {

    private NetworkProperties network = new NetworkProperties();
    private IngestionProperties ingestion = new IngestionProperties();
    private RetryProperties retry = new RetryProperties();
    private FactProperties facts = new FactProperties();
    private StateProperties state = new StateProperties();

    /**
     * Overrides for the per-network defaults in {@link L1Network}. Blank means default.
     */
    @Data
    public static class NetworkProperties {
        private String stateContractAddress;
        private String gpsVerifierAddress;
        private String memoryPageRegistryAddress;
        private Long deploymentBlock;
    }

    @Data
    public static class IngestionProperties {
        private boolean autoStart = true;
        private long windowSize = 10_000L;
        private int channelCapacity = 4_096;
        private long pollTimeoutMs = 1_000L;
        private long reconnectInitialBackoffMs = 1_000L;
        private long reconnectMaxBackoffMs = 60_000L;
        private long shutdownTimeoutMs = 10_000L;

        public Duration pollTimeout() {
            return Duration.ofMillis(pollTimeoutMs);
        }

        public Duration shutdownTimeout() {
            return Duration.ofMillis(shutdownTimeoutMs);
        }
    }

    @Data
    public static class RetryProperties {
        private int maxAttempts = 5;
        private long initialBackoffMs = 500L;
        private double multiplier = 2.0;
    }

    @Data
    public static class FactProperties {
        private long pollIntervalMs = 5_000L;
        private boolean strictOrdering = true;
    }

    @Data
    public static class StateProperties {
        private long pollIntervalMs = 120_000L;
        private boolean archiveBlocks = true;
    }
}
