package com.starksync.sync.fact;

import com.starksync.common.concurrent.ConcurrencyUtils;
import com.starksync.sync.checkpoint.CheckpointStore;
import com.starksync.sync.event.ChannelEntry;
import com.starksync.sync.event.IngestionProgress;
import com.starksync.sync.event.L1Event;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Moves events from the ingestion channel into the {@link FactRegistry} and
 * owns the L1 ingestion checkpoint.
 *
 * <p>The channel is FIFO, so when an {@link IngestionProgress} marker comes
 * off it every event before it has already been applied to the journal; only
 * then does the checkpoint move. An event that cannot be applied after
 * retries freezes the checkpoint until restart, so the next run ingests it
 * again.
 *
 * <p>Starts before the ingestion pipeline and stops after it; on stop it
 * applies whatever is still queued before exiting.
 */
@Slf4j
public class L1EventDispatcher implements SmartLifecycle {

    public static final int PHASE = Integer.MAX_VALUE - 2048;

    private final BlockingQueue<ChannelEntry> channel;
    private final FactRegistry registry;
    private final CheckpointStore checkpoint;
    private final Retry retry;
    private final Duration pollTimeout;
    private final Duration shutdownTimeout;
    private final boolean autoStartup;

    private volatile boolean running;
    private volatile boolean checkpointHeld;
    private volatile long dispatched;
    private ExecutorService executor;

    public L1EventDispatcher(BlockingQueue<ChannelEntry> channel,
                             FactRegistry registry,
                             CheckpointStore checkpoint,
                             Retry retry,
                             Duration pollTimeout,
                             Duration shutdownTimeout,
                             boolean autoStartup) {
        this.channel = channel;
        this.registry = registry;
        this.checkpoint = checkpoint;
        this.retry = retry;
        this.pollTimeout = pollTimeout;
        this.shutdownTimeout = shutdownTimeout;
        this.autoStartup = autoStartup;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        executor = ConcurrencyUtils.namedSingleThreadExecutor("l1-event-dispatcher");
        executor.submit(this::dispatchLoop);
        log.info("L1 event dispatcher started");
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        ConcurrencyUtils.shutdownGracefully(executor, shutdownTimeout);
        log.info("L1 event dispatcher stopped: dispatched={}, undelivered={}, checkpointHeld={}",
                dispatched, channel.size(), checkpointHeld);
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    public long getDispatched() {
        return dispatched;
    }

    public boolean isCheckpointHeld() {
        return checkpointHeld;
    }

    private void dispatchLoop() {
        try {
            while (running || !channel.isEmpty()) {
                ChannelEntry entry = channel.poll(pollTimeout.toMillis(), TimeUnit.MILLISECONDS);
                if (entry instanceof IngestionProgress progress) {
                    advance(progress.blockNumber());
                } else if (entry instanceof L1Event event) {
                    dispatch(event);
                } else if (entry != null) {
                    log.warn("Ignoring unsupported channel entry: {}", entry.getClass().getSimpleName());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Dispatcher interrupted with {} entries queued", channel.size());
        }
    }

    private void dispatch(L1Event event) {
        try {
            retry.executeRunnable(() -> registry.apply(event));
            dispatched++;
        } catch (RuntimeException e) {
            if (!checkpointHeld) {
                checkpointHeld = true;
                log.error("Ingestion checkpoint frozen until restart", e);
            }
            log.error("Failed to apply event: type={}, block={}, logIndex={}, error={}",
                    event.getClass().getSimpleName(), event.blockNumber(), event.logIndex(), e.getMessage());
        }
    }

    private void advance(long height) {
        if (checkpointHeld) {
            log.debug("Checkpoint frozen, ignoring progress to block={}", height);
            return;
        }
        try {
            retry.executeRunnable(() -> checkpoint.save(height));
        } catch (RuntimeException e) {
            log.warn("Failed to save ingestion checkpoint, next marker will retry: block={}, error={}",
                    height, e.getMessage());
        }
    }
}
