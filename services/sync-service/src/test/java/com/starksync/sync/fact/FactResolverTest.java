package com.starksync.sync.fact;

import com.starksync.common.exception.L1TransportException;
import com.starksync.common.retry.RetryPolicies;
import com.starksync.common.storage.InMemoryKeyValueStore;
import com.starksync.sync.l1.Hash32;
import com.starksync.sync.support.FakeL1Client;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.starksync.sync.support.TestLogs.hash;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FactResolver Tests")
class FactResolverTest {

    private static final Hash32 FACT_A = hash(0xa);
    private static final Hash32 FACT_B = hash(0xb);
    private static final Hash32 PAGE_1 = hash(0x101);
    private static final Hash32 PAGE_2 = hash(0x102);
    private static final Hash32 TX_1 = hash(0x201);
    private static final Hash32 TX_2 = hash(0x202);

    private final List<ResolvedFact> delivered = new CopyOnWriteArrayList<>();
    private final Retry retry = RetryPolicies.exponentialBackoff(
            "test-fetch", 2, Duration.ofMillis(1), 1.0, L1TransportException.class);

    private SimpleMeterRegistry meterRegistry;
    private FakeL1Client l1Client;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        l1Client = new FakeL1Client(1L, 0L)
                .withTransaction(TX_1, new byte[]{1, 1})
                .withTransaction(TX_2, new byte[]{2, 2, 2});
    }

    private static FactRegistry registry() {
        return new FactRegistry(new FactJournal(new InMemoryKeyValueStore()), true);
    }

    private FactResolver resolver(FactRegistry registry) {
        return new FactResolver(registry, l1Client, retry, List.of(delivered::add), meterRegistry);
    }

    @Nested
    @DisplayName("Resolution")
    class ResolutionTests {

        @Test
        @DisplayName("Should deliver the pages in page-set order")
        void shouldDeliverOrderedPages() {
            // Given
            FactRegistry registry = registry();
            registry.observeFact(FACT_A);
            registry.recordPages(FACT_A, List.of(PAGE_2, PAGE_1));
            registry.recordPageTransaction(PAGE_1, TX_1);
            registry.recordPageTransaction(PAGE_2, TX_2);

            // When
            int resolved = resolver(registry).resolvePending();

            // Then
            assertThat(resolved).isEqualTo(1);
            assertThat(delivered).singleElement().satisfies(fact -> {
                assertThat(fact.factHash()).isEqualTo(FACT_A);
                assertThat(fact.pages()).containsExactly(new byte[]{2, 2, 2}, new byte[]{1, 1});
                assertThat(fact.totalBytes()).isEqualTo(5L);
            });
            assertThat(registry.status(FACT_A)).contains(FactStatus.RESOLVED);
            assertThat(meterRegistry.counter("starksync.facts.resolved").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should keep draining after each resolved fact")
        void shouldDrainQueue() {
            FactRegistry registry = registry();
            registry.observeFact(FACT_A);
            registry.observeFact(FACT_B);
            registry.recordPages(FACT_A, List.of(PAGE_1));
            registry.recordPages(FACT_B, List.of(PAGE_2));
            registry.recordPageTransaction(PAGE_1, TX_1);
            registry.recordPageTransaction(PAGE_2, TX_2);

            assertThat(resolver(registry).resolvePending()).isEqualTo(2);

            assertThat(delivered).extracting(ResolvedFact::factHash).containsExactly(FACT_A, FACT_B);
        }

        @Test
        @DisplayName("Should resolve only after every dependency is known")
        void shouldWaitForDependencies() {
            FactRegistry registry = registry();
            FactResolver resolver = resolver(registry);
            registry.observeFact(FACT_A);

            assertThat(resolver.resolvePending()).isZero();
            registry.recordPages(FACT_A, List.of(PAGE_1, PAGE_2));
            assertThat(resolver.resolvePending()).isZero();
            registry.recordPageTransaction(PAGE_1, TX_1);
            assertThat(resolver.resolvePending()).isZero();
            registry.recordPageTransaction(PAGE_2, TX_2);

            assertThat(resolver.resolvePending()).isEqualTo(1);
            assertThat(delivered).singleElement().extracting(ResolvedFact::pageCount).isEqualTo(2);
        }

        @Test
        @DisplayName("Should process a fact at most once")
        void shouldResolveOnce() {
            FactRegistry registry = registry();
            FactResolver resolver = resolver(registry);
            registry.observeFact(FACT_A);
            registry.recordPages(FACT_A, List.of(PAGE_1));
            registry.recordPageTransaction(PAGE_1, TX_1);

            resolver.resolvePending();
            registry.observeFact(FACT_A);
            resolver.resolvePending();

            assertThat(delivered).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Fetch failures")
    class FailureTests {

        @Test
        @DisplayName("Should put the fact back at the front when fetches keep failing")
        void shouldRequeueOnTransportFailure() {
            // Given
            FactRegistry registry = registry();
            registry.observeFact(FACT_A);
            registry.observeFact(FACT_B);
            registry.recordPages(FACT_A, List.of(PAGE_1));
            registry.recordPageTransaction(PAGE_1, TX_1);
            l1Client.failTransactionFetches(2);
            FactResolver resolver = resolver(registry);

            // When
            int firstPass = resolver.resolvePending();

            // Then
            assertThat(firstPass).isZero();
            assertThat(delivered).isEmpty();
            assertThat(registry.pendingFacts()).containsExactly(FACT_A, FACT_B);

            assertThat(resolver.resolvePending()).isEqualTo(1);
            assertThat(delivered).extracting(ResolvedFact::factHash).containsExactly(FACT_A);
        }

        @Test
        @DisplayName("Should treat a missing transaction as a deferred fetch")
        void shouldRequeueOnMissingTransaction() {
            FactRegistry registry = registry();
            Hash32 unknownTx = hash(0x999);
            registry.observeFact(FACT_A);
            registry.recordPages(FACT_A, List.of(PAGE_1));
            registry.recordPageTransaction(PAGE_1, unknownTx);

            assertThat(resolver(registry).resolvePending()).isZero();

            assertThat(registry.status(FACT_A)).contains(FactStatus.PAGES_KNOWN);
            assertThat(meterRegistry.counter("starksync.facts.fetch.failures").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should keep resolving when a listener throws")
        void shouldIsolateListenerFailures() {
            FactRegistry registry = registry();
            registry.observeFact(FACT_A);
            registry.observeFact(FACT_B);
            registry.recordPages(FACT_A, List.of());
            registry.recordPages(FACT_B, List.of());
            ResolvedFactListener failing = fact -> {
                throw new IllegalStateException("listener down");
            };
            FactResolver resolver = new FactResolver(registry, l1Client, retry,
                    List.of(failing, delivered::add), meterRegistry);

            assertThat(resolver.resolvePending()).isEqualTo(2);
            assertThat(delivered).hasSize(2);
        }
    }
}
