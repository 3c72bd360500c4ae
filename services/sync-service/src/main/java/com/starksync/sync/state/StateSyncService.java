package com.starksync.sync.state;

import com.starksync.common.exception.CommitmentException;
import com.starksync.common.exception.StarkSyncException;
import com.starksync.sync.feeder.FeederClient;
import com.starksync.sync.feeder.StateUpdate;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Pulls state updates from the feeder past the materializer checkpoint and
 * applies them in height order.
 *
 * <p>A commitment failure halts the service until restart. Transport and
 * persistence failures end the current pass; the next pass retries the same block.
 */
@Slf4j
public class StateSyncService {

    private final FeederClient feederClient;
    private final StateMaterializer materializer;

    private volatile MaterializerStatus status = MaterializerStatus.RUNNING;
    private volatile Long haltedBlock;

    public StateSyncService(FeederClient feederClient, StateMaterializer materializer) {
        this.feederClient = feederClient;
        this.materializer = materializer;
    }

    /**
     * @return number of blocks committed in this pass
     */
    public synchronized int syncAvailableBlocks() {
        if (status == MaterializerStatus.HALTED) {
            log.debug("Materializer halted at block={}, skipping pass", haltedBlock);
            return 0;
        }
        OptionalLong synced = materializer.getCheckpoint().find();
        long next = synced.isPresent() ? synced.getAsLong() + 1 : 0L;
        int committed = 0;
        while (true) {
            try {
                Optional<StateUpdate> update = feederClient.getStateUpdate(next);
                if (update.isEmpty()) {
                    break;
                }
                if (materializer.materialize(update.get()) == MaterializationResult.COMMITTED) {
                    committed++;
                }
                next++;
            } catch (CommitmentException e) {
                halt(next, e);
                break;
            } catch (StarkSyncException e) {
                log.warn("State sync interrupted, will retry: block={}, code={}, error={}",
                        next, e.getErrorCode().getCode(), e.getMessage());
                break;
            }
        }
        if (committed > 0) {
            log.info("State sync pass committed {} blocks, next={}", committed, next);
        }
        return committed;
    }

    public MaterializerStatus getStatus() {
        return status;
    }

    public OptionalLong getHaltedBlock() {
        Long block = haltedBlock;
        return block == null ? OptionalLong.empty() : OptionalLong.of(block);
    }

    private void halt(long blockNumber, CommitmentException e) {
        haltedBlock = blockNumber;
        status = MaterializerStatus.HALTED;
        log.error("Materializer halted: block={}, code={}, metadata={}, error={}",
                blockNumber, e.getErrorCode().getCode(), e.getMetadata(), e.getMessage(), e);
    }
}
