package com.starksync.sync.checkpoint;

import com.starksync.common.exception.PersistenceException;
import com.starksync.common.exception.SyncErrorCode;
import com.starksync.common.storage.InMemoryKeyValueStore;
import com.starksync.common.storage.KeyValueStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CheckpointStore Tests")
class CheckpointStoreTest {

    @Mock
    private KeyValueStore failingStore;

    @Nested
    @DisplayName("Load and save")
    class LoadSaveTests {

        @Test
        @DisplayName("Should report a cold start as 0 and as empty")
        void shouldHandleColdStart() {
            CheckpointStore checkpoint = new CheckpointStore(new InMemoryKeyValueStore(), CheckpointStore.L1_INGESTION_KEY);

            assertThat(checkpoint.load()).isZero();
            assertThat(checkpoint.find()).isEmpty();
        }

        @Test
        @DisplayName("Should store the height as 8 big-endian bytes under the fixed key")
        void shouldStoreBigEndian() {
            InMemoryKeyValueStore store = new InMemoryKeyValueStore();
            CheckpointStore checkpoint = new CheckpointStore(store, CheckpointStore.L1_INGESTION_KEY);

            checkpoint.save(0x0102L);

            assertThat(store.get("latestL1BlockIngested".getBytes(StandardCharsets.UTF_8)))
                    .hasValueSatisfying(raw -> assertThat(raw).containsExactly(0, 0, 0, 0, 0, 0, 1, 2));
        }

        @Test
        @DisplayName("Should survive a restart with the last confirmed height")
        void shouldSurviveRestart() {
            InMemoryKeyValueStore store = new InMemoryKeyValueStore();
            new CheckpointStore(store, CheckpointStore.L2_SYNC_KEY).save(42L);

            CheckpointStore reopened = new CheckpointStore(store, CheckpointStore.L2_SYNC_KEY);

            assertThat(reopened.load()).isEqualTo(42L);
            assertThat(reopened.find()).hasValue(42L);
        }

        @Test
        @DisplayName("Should never move backwards")
        void shouldBeMonotonic() {
            CheckpointStore checkpoint = new CheckpointStore(new InMemoryKeyValueStore(), CheckpointStore.L1_INGESTION_KEY);

            assertThat(checkpoint.save(100L)).isTrue();
            assertThat(checkpoint.save(90L)).isFalse();
            assertThat(checkpoint.save(100L)).isFalse();

            assertThat(checkpoint.load()).isEqualTo(100L);
        }

        @Test
        @DisplayName("Should keep separate keys independent")
        void shouldSeparateKeys() {
            InMemoryKeyValueStore store = new InMemoryKeyValueStore();
            CheckpointStore l1 = new CheckpointStore(store, CheckpointStore.L1_INGESTION_KEY);
            CheckpointStore l2 = new CheckpointStore(store, CheckpointStore.L2_SYNC_KEY);

            l1.save(500L);

            assertThat(l2.find()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Should not advance when the write fails")
        void shouldNotAdvanceOnWriteFailure() {
            // Given
            when(failingStore.get(any())).thenReturn(Optional.empty());
            doThrow(new IllegalStateException("disk full")).when(failingStore).put(any(), any());
            CheckpointStore checkpoint = new CheckpointStore(failingStore, CheckpointStore.L1_INGESTION_KEY);

            // When / Then
            assertThatThrownBy(() -> checkpoint.save(10L))
                    .isInstanceOf(PersistenceException.class)
                    .satisfies(e -> {
                        PersistenceException pe = (PersistenceException) e;
                        assertThat(pe.getErrorCode()).isEqualTo(SyncErrorCode.STORE_WRITE_FAILED);
                        assertThat(pe.isRetryable()).isTrue();
                        assertThat(pe.getKey()).isEqualTo(CheckpointStore.L1_INGESTION_KEY);
                    });
            assertThat(checkpoint.find()).isEmpty();
        }

        @Test
        @DisplayName("Should advance once a retried write succeeds")
        void shouldAdvanceAfterRetry() {
            when(failingStore.get(any())).thenReturn(Optional.empty());
            doThrow(new IllegalStateException("busy")).doNothing().when(failingStore).put(any(), any());
            CheckpointStore checkpoint = new CheckpointStore(failingStore, CheckpointStore.L1_INGESTION_KEY);

            assertThatThrownBy(() -> checkpoint.save(10L)).isInstanceOf(PersistenceException.class);
            assertThat(checkpoint.save(10L)).isTrue();

            assertThat(checkpoint.load()).isEqualTo(10L);
        }

        @Test
        @DisplayName("Should flag a stored value of the wrong size as corrupted")
        void shouldRejectCorruptedValue() {
            InMemoryKeyValueStore store = new InMemoryKeyValueStore();
            store.put(CheckpointStore.L1_INGESTION_KEY.getBytes(StandardCharsets.UTF_8), new byte[]{1, 2, 3});
            CheckpointStore checkpoint = new CheckpointStore(store, CheckpointStore.L1_INGESTION_KEY);

            assertThatThrownBy(checkpoint::load)
                    .isInstanceOf(PersistenceException.class)
                    .satisfies(e -> assertThat(((PersistenceException) e).isRetryable()).isFalse());
        }
    }
}
