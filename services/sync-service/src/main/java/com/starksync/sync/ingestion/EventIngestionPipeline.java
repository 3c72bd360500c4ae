package com.starksync.sync.ingestion;

import com.starksync.common.concurrent.ConcurrencyUtils;
import com.starksync.common.exception.EventDecodeException;
import com.starksync.common.exception.L1TransportException;
import com.starksync.sync.abi.EventDecoder;
import com.starksync.sync.checkpoint.CheckpointStore;
import com.starksync.sync.config.SyncProperties;
import com.starksync.sync.event.ChannelEntry;
import com.starksync.sync.event.IngestionProgress;
import com.starksync.sync.event.L1Event;
import com.starksync.sync.event.L1EventMapper;
import com.starksync.sync.l1.ContractDirectory;
import com.starksync.sync.l1.L1Client;
import com.starksync.sync.l1.L1Log;
import com.starksync.sync.l1.LogFilter;
import com.starksync.sync.l1.LogSubscription;
import com.starksync.sync.l1.WatchedContract;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;

/**
 * Streams decoded events from the watched L1 contracts onto the event channel.
 *
 * <p>Backfill walks inclusive windows from the deployment block (or just past
 * the checkpoint) up to the head read at startup, following each window with
 * an {@link IngestionProgress} marker. Live tail then subscribes from the next
 * block and reconnects with capped exponential backoff whenever the
 * subscription breaks. The pipeline only reads the checkpoint; the consumer
 * of the channel advances it as markers come through.
 *
 * <p>Each log is emitted at most once: anything at or before the last emitted
 * {@code (block, logIndex)} is dropped, which covers the backfill/live boundary
 * and replays after a reconnect.
 */
@Slf4j
public class EventIngestionPipeline implements SmartLifecycle {

    public static final int PHASE = Integer.MAX_VALUE - 1024;

    private static final Comparator<L1Log> CHAIN_ORDER =
            Comparator.comparingLong(L1Log::blockNumber).thenComparingLong(L1Log::logIndex);

    private final L1Client l1Client;
    private final ContractDiscovery discovery;
    private final EventDecoder decoder;
    private final L1EventMapper mapper;
    private final CheckpointStore checkpoint;
    private final BlockingQueue<ChannelEntry> channel;
    private final Retry retry;
    private final SyncProperties.IngestionProperties settings;

    private final Counter fetchedCounter;
    private final Counter emittedCounter;
    private final Counter skippedCounter;
    private final Counter duplicateCounter;
    private final Counter reconnectCounter;

    private volatile boolean running;
    private volatile IngestionPhase phase = IngestionPhase.IDLE;
    private volatile ContractDirectory directory;
    private volatile Throwable failure;
    private ExecutorService executor;

    // Ingestion thread only
    private long lastEmittedBlock = -1;
    private long lastEmittedLogIndex = -1;
    private long liveBlock;
    private long lastProgress = -1;

    public EventIngestionPipeline(L1Client l1Client,
                                  ContractDiscovery discovery,
                                  EventDecoder decoder,
                                  L1EventMapper mapper,
                                  CheckpointStore checkpoint,
                                  BlockingQueue<ChannelEntry> channel,
                                  Retry retry,
                                  SyncProperties.IngestionProperties settings,
                                  MeterRegistry meterRegistry) {
        this.l1Client = l1Client;
        this.discovery = discovery;
        this.decoder = decoder;
        this.mapper = mapper;
        this.checkpoint = checkpoint;
        this.channel = channel;
        this.retry = retry;
        this.settings = settings;
        this.fetchedCounter = meterRegistry.counter("starksync.l1.logs.fetched");
        this.emittedCounter = meterRegistry.counter("starksync.l1.events.emitted");
        this.skippedCounter = meterRegistry.counter("starksync.l1.events.skipped");
        this.duplicateCounter = meterRegistry.counter("starksync.l1.events.duplicates");
        this.reconnectCounter = meterRegistry.counter("starksync.l1.subscription.reconnects");
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        failure = null;
        phase = IngestionPhase.IDLE;
        executor = ConcurrencyUtils.namedSingleThreadExecutor("l1-ingestion");
        executor.submit(this::run);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        boolean drained = ConcurrencyUtils.shutdownGracefully(executor, settings.shutdownTimeout());
        if (phase != IngestionPhase.FAILED) {
            phase = IngestionPhase.STOPPED;
        }
        log.info("Ingestion pipeline stopped: phase={}, drained={}", phase, drained);
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return settings.isAutoStart();
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    public IngestionPhase phase() {
        return phase;
    }

    public Optional<Throwable> getFailure() {
        return Optional.ofNullable(failure);
    }

    public Optional<ContractDirectory> getDirectory() {
        return Optional.ofNullable(directory);
    }

    private void run() {
        try {
            ContractDirectory resolved = retry.executeSupplier(discovery::discover);
            directory = resolved;
            long head = retry.executeSupplier(l1Client::blockNumber);
            long backfilledTo = backfill(resolved, head);
            if (running) {
                liveTail(resolved, backfilledTo);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Ingestion interrupted: phase={}", phase);
        } catch (RuntimeException e) {
            if (running) {
                IngestionPhase failedIn = phase;
                failure = e;
                phase = IngestionPhase.FAILED;
                log.error("Ingestion pipeline failed: phase={}, error={}", failedIn, e.getMessage(), e);
            } else {
                log.warn("Ingestion aborted during shutdown: error={}", e.getMessage());
            }
        } finally {
            if (phase != IngestionPhase.FAILED) {
                phase = IngestionPhase.STOPPED;
            }
        }
    }

    /**
     * @return the last block covered, the head unless stopped early
     */
    private long backfill(ContractDirectory dir, long head) throws InterruptedException {
        phase = IngestionPhase.BACKFILL;
        OptionalLong stored = checkpoint.find();
        long from = stored.isPresent()
                ? Math.max(dir.getDeploymentBlock(), stored.getAsLong() + 1)
                : dir.getDeploymentBlock();
        long window = Math.max(1L, settings.getWindowSize());
        log.info("Backfill starting: fromBlock={}, head={}, window={}", from, head, window);

        while (running && from <= head) {
            long to = Math.min(from + window - 1, head);
            LogFilter filter = dir.window(from, to);
            List<L1Log> logs = retry.executeSupplier(() -> l1Client.filterLogs(filter));
            fetchedCounter.increment(logs.size());
            for (L1Log entry : logs.stream().sorted(CHAIN_ORDER).toList()) {
                emit(dir, entry);
            }
            publishProgress(to);
            log.info("Backfill window done: fromBlock={}, toBlock={}, logs={}", from, to, logs.size());
            from = to + 1;
        }
        return from - 1;
    }

    private void liveTail(ContractDirectory dir, long backfilledTo) throws InterruptedException {
        phase = IngestionPhase.LIVE_TAIL;
        liveBlock = backfilledTo;
        long backoffMs = settings.getReconnectInitialBackoffMs();
        while (running) {
            long from = Math.max(backfilledTo + 1, lastEmittedBlock);
            try (LogSubscription subscription = l1Client.subscribeFilterLogs(dir.from(from))) {
                log.info("Live tail subscribed: fromBlock={}", from);
                while (running) {
                    Optional<L1Log> next = subscription.poll(settings.pollTimeout());
                    if (next.isPresent()) {
                        onLiveLog(dir, next.get());
                        backoffMs = settings.getReconnectInitialBackoffMs();
                    }
                }
            } catch (L1TransportException e) {
                if (!running) {
                    break;
                }
                reconnectCounter.increment();
                log.warn("Live tail subscription failed, reconnecting: operation={}, fromBlock={}, backoffMs={}, error={}",
                        e.getOperation(), from, backoffMs, e.getMessage());
                pause(backoffMs);
                backoffMs = Math.min(backoffMs * 2, settings.getReconnectMaxBackoffMs());
            }
        }
    }

    private void onLiveLog(ContractDirectory dir, L1Log entry) throws InterruptedException {
        if (!entry.removed() && entry.blockNumber() > liveBlock) {
            publishProgress(entry.blockNumber() - 1);
            liveBlock = entry.blockNumber();
        }
        emit(dir, entry);
    }

    private void emit(ContractDirectory dir, L1Log entry) throws InterruptedException {
        if (entry.removed()) {
            skippedCounter.increment();
            log.warn("Dropping removed log: block={}, logIndex={}, tx={}",
                    entry.blockNumber(), entry.logIndex(), entry.transactionHash());
            return;
        }
        if (!entry.isAfter(lastEmittedBlock, lastEmittedLogIndex)) {
            duplicateCounter.increment();
            log.debug("Dropping replayed log: block={}, logIndex={}", entry.blockNumber(), entry.logIndex());
            return;
        }
        lastEmittedBlock = entry.blockNumber();
        lastEmittedLogIndex = entry.logIndex();

        Optional<WatchedContract> contract = dir.resolve(entry.address());
        if (contract.isEmpty()) {
            skippedCounter.increment();
            log.warn("Skipping log from unwatched address={}, block={}, logIndex={}",
                    entry.address(), entry.blockNumber(), entry.logIndex());
            return;
        }
        L1Event event;
        try {
            event = mapper.map(contract.get(), entry, decoder.decode(contract.get(), entry));
        } catch (EventDecodeException e) {
            skippedCounter.increment();
            log.warn("Skipping undecodable log: event={}, block={}, logIndex={}, tx={}, error={}",
                    e.getEventName(), entry.blockNumber(), entry.logIndex(), entry.transactionHash(), e.getMessage());
            return;
        }
        channel.put(event);
        emittedCounter.increment();
    }

    private void publishProgress(long height) throws InterruptedException {
        if (height > lastProgress) {
            channel.put(new IngestionProgress(height));
            lastProgress = height;
        }
    }

    private void pause(long millis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + millis;
        long slice = Math.max(1L, settings.getPollTimeoutMs());
        while (running) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return;
            }
            Thread.sleep(Math.min(remaining, slice));
        }
    }
}
