package com.starksync.sync.ingestion;

import com.starksync.common.exception.L1TransportException;
import com.starksync.common.exception.PersistenceException;
import com.starksync.common.retry.RetryPolicies;
import com.starksync.common.storage.InMemoryKeyValueStore;
import com.starksync.sync.abi.StarknetAbiDecoder;
import com.starksync.sync.checkpoint.CheckpointStore;
import com.starksync.sync.config.SyncContext;
import com.starksync.sync.config.SyncProperties;
import com.starksync.sync.event.ChannelEntry;
import com.starksync.sync.event.L1EventMapper;
import com.starksync.sync.fact.FactJournal;
import com.starksync.sync.fact.FactRegistry;
import com.starksync.sync.fact.FactResolver;
import com.starksync.sync.fact.FactStatus;
import com.starksync.sync.fact.L1EventDispatcher;
import com.starksync.sync.fact.ResolvedFact;
import com.starksync.sync.feeder.ContractAddresses;
import com.starksync.sync.feeder.FeederClient;
import com.starksync.sync.l1.Hash32;
import com.starksync.sync.l1.LogFilter;
import com.starksync.sync.support.FakeL1Client;
import com.starksync.sync.support.TestLogs;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.starksync.sync.support.TestLogs.hash;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Pipeline, dispatcher, registry and resolver run twice over one store, the
 * way a node restart sees them.
 */
@DisplayName("Ingestion restart Tests")
class IngestionRestartTest {

    private static final long FLOOR = 100L;
    private static final Duration WAIT = Duration.ofSeconds(10);

    private static final Hash32 FACT_1 = hash(1);
    private static final Hash32 FACT_2 = hash(2);
    private static final Hash32 FACT_3 = hash(3);
    private static final Hash32 PAGE_11 = hash(11);
    private static final Hash32 PAGE_21 = hash(21);
    private static final Hash32 PAGE_31 = hash(31);

    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore();
    private final CheckpointStore checkpoint = new CheckpointStore(store, CheckpointStore.L1_INGESTION_KEY);
    private final List<ResolvedFact> delivered = new CopyOnWriteArrayList<>();

    /**
     * One process lifetime: the shared store plus fresh in-memory components.
     */
    private final class Run implements AutoCloseable {

        private final FakeL1Client client;
        private final FactRegistry registry;
        private final int restored;
        private final EventIngestionPipeline pipeline;
        private final L1EventDispatcher dispatcher;

        private Run(FakeL1Client client) {
            this.client = client;
            this.registry = new FactRegistry(new FactJournal(store), true);
            this.restored = registry.restore();

            SyncProperties properties = new SyncProperties();
            properties.getNetwork().setDeploymentBlock(FLOOR);
            SyncProperties.IngestionProperties ingestion = properties.getIngestion();
            ingestion.setWindowSize(10);
            ingestion.setPollTimeoutMs(20);
            ingestion.setShutdownTimeoutMs(2_000);

            FeederClient feeder = mock(FeederClient.class);
            when(feeder.getContractAddresses())
                    .thenReturn(new ContractAddresses(TestLogs.STATE_ADDRESS, TestLogs.GPS_ADDRESS));
            SyncContext context = new SyncContext(client, feeder, store, properties);

            ArrayBlockingQueue<ChannelEntry> channel = new ArrayBlockingQueue<>(64);
            this.dispatcher = new L1EventDispatcher(channel, registry, checkpoint,
                    RetryPolicies.exponentialBackoff("test-dispatch", 3, Duration.ofMillis(1), 1.0,
                            PersistenceException.class),
                    Duration.ofMillis(20), Duration.ofSeconds(2), true);
            this.pipeline = new EventIngestionPipeline(
                    client,
                    new ContractDiscovery(context),
                    new StarknetAbiDecoder(),
                    new L1EventMapper(),
                    checkpoint,
                    channel,
                    RetryPolicies.exponentialBackoff("test-ingestion", 3, Duration.ofMillis(1), 1.0,
                            L1TransportException.class, PersistenceException.class),
                    ingestion,
                    new SimpleMeterRegistry());

            dispatcher.start();
            pipeline.start();
            await().atMost(WAIT).until(() -> checkpoint.load() == client.blockNumber());
        }

        private FactResolver resolver() {
            return new FactResolver(registry, client,
                    RetryPolicies.exponentialBackoff("test-fetch", 2, Duration.ofMillis(1), 1.0,
                            L1TransportException.class),
                    List.of(delivered::add), new SimpleMeterRegistry());
        }

        @Override
        public void close() {
            pipeline.stop();
            dispatcher.stop();
        }
    }

    @Test
    @DisplayName("Should resolve facts whose page events were ingested before the restart")
    void shouldResolveAcrossRestart() {
        // Given: the first run ingests up to block 135 and stops with nothing resolvable
        FakeL1Client firstNode = new FakeL1Client(1L, 135L)
                .withLogs(TestLogs.memoryPage(FACT_1, PAGE_11, 102, 0),
                        TestLogs.pagesHashes(FACT_1, List.of(PAGE_11), 104, 0),
                        TestLogs.stateFact(FACT_3, 130, 0),
                        TestLogs.pagesHashes(FACT_3, List.of(PAGE_31), 131, 0));
        try (Run first = new Run(firstNode)) {
            assertThat(first.registry.pendingFacts()).containsExactly(FACT_3);
            assertThat(first.resolver().resolvePending()).isZero();
        }
        assertThat(checkpoint.load()).isEqualTo(135L);

        // When: the second run starts from the stored checkpoint with a fresh registry
        FakeL1Client secondNode = new FakeL1Client(1L, 145L)
                .withLogs(TestLogs.memoryPage(FACT_1, PAGE_11, 102, 0),
                        TestLogs.pagesHashes(FACT_1, List.of(PAGE_11), 104, 0),
                        TestLogs.stateFact(FACT_3, 130, 0),
                        TestLogs.pagesHashes(FACT_3, List.of(PAGE_31), 131, 0),
                        TestLogs.stateFact(FACT_1, 140, 0),
                        TestLogs.memoryPage(FACT_2, PAGE_21, 141, 0),
                        TestLogs.pagesHashes(FACT_2, List.of(PAGE_21), 142, 0),
                        TestLogs.stateFact(FACT_2, 143, 0),
                        TestLogs.memoryPage(FACT_3, PAGE_31, 144, 0))
                .withTransaction(TestLogs.transactionHash(102, 0), new byte[]{1})
                .withTransaction(TestLogs.transactionHash(141, 0), new byte[]{2, 2})
                .withTransaction(TestLogs.transactionHash(144, 0), new byte[]{3, 3, 3});
        try (Run second = new Run(secondNode)) {
            // Then
            assertThat(second.restored).isEqualTo(1);
            assertThat(secondNode.getFilterCalls()).extracting(LogFilter::fromBlock).containsExactly(136L);
            assertThat(second.resolver().resolvePending()).isEqualTo(3);

            assertThat(delivered).extracting(ResolvedFact::factHash).containsExactly(FACT_3, FACT_1, FACT_2);
            assertThat(delivered).extracting(ResolvedFact::totalBytes).containsExactly(3L, 1L, 2L);
            assertThat(second.registry.status(FACT_1)).contains(FactStatus.RESOLVED);
            assertThat(second.registry.status(FACT_2)).contains(FactStatus.RESOLVED);
            assertThat(second.registry.status(FACT_3)).contains(FactStatus.RESOLVED);
            assertThat(second.registry.heldEntries()).isZero();
            assertThat(second.dispatcher.isCheckpointHeld()).isFalse();
        }
    }

    @Test
    @DisplayName("Should not deliver a fact again when a restart replays it")
    void shouldNotRedeliverAfterRestart() {
        // Given
        FakeL1Client node = new FakeL1Client(1L, 110L)
                .withLogs(TestLogs.stateFact(FACT_1, 101, 0),
                        TestLogs.pagesHashes(FACT_1, List.of(PAGE_11), 102, 0),
                        TestLogs.memoryPage(FACT_1, PAGE_11, 103, 0))
                .withTransaction(TestLogs.transactionHash(103, 0), new byte[]{1});
        try (Run first = new Run(node)) {
            assertThat(first.resolver().resolvePending()).isOne();
        }

        // When: the checkpoint is lost and everything is ingested again
        store.delete(CheckpointStore.L1_INGESTION_KEY.getBytes(StandardCharsets.UTF_8));
        try (Run second = new Run(node)) {
            // Then
            assertThat(second.restored).isZero();
            assertThat(second.registry.pendingCount()).isZero();
            assertThat(second.resolver().resolvePending()).isZero();
        }
        assertThat(delivered).extracting(ResolvedFact::factHash).containsExactly(FACT_1);
    }
}
