package com.starksync.sync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.starksync.common.exception.FeederException;
import com.starksync.common.exception.L1TransportException;
import com.starksync.common.exception.PersistenceException;
import com.starksync.common.retry.RetryPolicies;
import com.starksync.common.storage.InMemoryKeyValueStore;
import com.starksync.common.storage.KeyValueStore;
import com.starksync.sync.abi.EventDecoder;
import com.starksync.sync.abi.StarknetAbiDecoder;
import com.starksync.sync.checkpoint.CheckpointStore;
import com.starksync.sync.event.ChannelEntry;
import com.starksync.sync.event.L1EventMapper;
import com.starksync.sync.fact.FactJournal;
import com.starksync.sync.fact.FactRegistry;
import com.starksync.sync.fact.FactResolver;
import com.starksync.sync.fact.L1EventDispatcher;
import com.starksync.sync.fact.ResolvedFactListener;
import com.starksync.sync.feeder.FeederClient;
import com.starksync.sync.ingestion.ContractDiscovery;
import com.starksync.sync.ingestion.EventIngestionPipeline;
import com.starksync.sync.l1.L1Client;
import com.starksync.sync.state.BlockArchive;
import com.starksync.sync.state.CodeStore;
import com.starksync.sync.state.ContractHashStore;
import com.starksync.sync.state.StateMaterializer;
import com.starksync.sync.state.StateSyncService;
import com.starksync.sync.state.TrieFactory;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Wires the sync pipeline. The L1 client, feeder client and trie factory are
 * supplied by the deploying application.
 */
@Slf4j
@Configuration
public class SyncConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public KeyValueStore keyValueStore() {
        log.warn("No KeyValueStore configured, using a volatile in-memory store");
        return new InMemoryKeyValueStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventDecoder eventDecoder() {
        return new StarknetAbiDecoder();
    }

    @Bean(destroyMethod = "close")
    public SyncContext syncContext(L1Client l1Client,
                                   FeederClient feederClient,
                                   KeyValueStore keyValueStore,
                                   SyncProperties properties) {
        return new SyncContext(l1Client, feederClient, keyValueStore, properties);
    }

    @Bean
    public BlockingQueue<ChannelEntry> l1EventChannel(SyncProperties properties) {
        return new ArrayBlockingQueue<>(properties.getIngestion().getChannelCapacity());
    }

    @Bean
    public CheckpointStore l1IngestionCheckpoint(SyncContext context) {
        return new CheckpointStore(context.getKeyValueStore(), CheckpointStore.L1_INGESTION_KEY);
    }

    @Bean
    public CheckpointStore l2SyncCheckpoint(SyncContext context) {
        return new CheckpointStore(context.getKeyValueStore(), CheckpointStore.L2_SYNC_KEY);
    }

    @Bean
    public Retry ingestionRetry(SyncProperties properties) {
        return retry("l1-ingestion", properties);
    }

    @Bean
    public Retry factFetchRetry(SyncProperties properties) {
        return retry("fact-fetch", properties);
    }

    @Bean
    public EventIngestionPipeline eventIngestionPipeline(SyncContext context,
                                                         EventDecoder eventDecoder,
                                                         BlockingQueue<ChannelEntry> l1EventChannel,
                                                         @Qualifier("l1IngestionCheckpoint") CheckpointStore checkpoint,
                                                         @Qualifier("ingestionRetry") Retry retry,
                                                         MeterRegistry meterRegistry) {
        return new EventIngestionPipeline(
                context.getL1Client(),
                new ContractDiscovery(context),
                eventDecoder,
                new L1EventMapper(),
                checkpoint,
                l1EventChannel,
                retry,
                context.getProperties().getIngestion(),
                meterRegistry);
    }

    @Bean
    public FactRegistry factRegistry(SyncContext context) {
        FactRegistry registry = new FactRegistry(new FactJournal(context.getKeyValueStore()),
                context.getProperties().getFacts().isStrictOrdering());
        registry.restore();
        return registry;
    }

    @Bean
    public L1EventDispatcher l1EventDispatcher(BlockingQueue<ChannelEntry> l1EventChannel,
                                               FactRegistry factRegistry,
                                               @Qualifier("l1IngestionCheckpoint") CheckpointStore checkpoint,
                                               @Qualifier("ingestionRetry") Retry retry,
                                               SyncProperties properties) {
        SyncProperties.IngestionProperties ingestion = properties.getIngestion();
        return new L1EventDispatcher(l1EventChannel, factRegistry, checkpoint, retry,
                ingestion.pollTimeout(), ingestion.shutdownTimeout(), ingestion.isAutoStart());
    }

    @Bean
    public FactResolver factResolver(FactRegistry factRegistry,
                                     SyncContext context,
                                     @Qualifier("factFetchRetry") Retry retry,
                                     List<ResolvedFactListener> listeners,
                                     MeterRegistry meterRegistry) {
        return new FactResolver(factRegistry, context.getL1Client(), retry, listeners, meterRegistry);
    }

    @Bean
    public StateMaterializer stateMaterializer(SyncContext context,
                                               TrieFactory trieFactory,
                                               ObjectMapper objectMapper,
                                               @Qualifier("l2SyncCheckpoint") CheckpointStore checkpoint,
                                               MeterRegistry meterRegistry) {
        KeyValueStore store = context.getKeyValueStore();
        return new StateMaterializer(
                context.getFeederClient(),
                trieFactory,
                new CodeStore(store, objectMapper),
                new ContractHashStore(store),
                new BlockArchive(store, objectMapper),
                checkpoint,
                context.getProperties().getState().isArchiveBlocks(),
                meterRegistry);
    }

    @Bean
    public StateSyncService stateSyncService(SyncContext context, StateMaterializer stateMaterializer) {
        return new StateSyncService(context.getFeederClient(), stateMaterializer);
    }

    private static Retry retry(String name, SyncProperties properties) {
        SyncProperties.RetryProperties retry = properties.getRetry();
        return RetryPolicies.exponentialBackoff(name,
                retry.getMaxAttempts(),
                Duration.ofMillis(retry.getInitialBackoffMs()),
                retry.getMultiplier(),
                L1TransportException.class, FeederException.class, PersistenceException.class);
    }
}
