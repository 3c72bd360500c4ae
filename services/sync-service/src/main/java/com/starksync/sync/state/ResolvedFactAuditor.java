package com.starksync.sync.state;

import com.starksync.sync.fact.ResolvedFact;
import com.starksync.sync.fact.ResolvedFactListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Records every resolved fact next to the state side for cross-checking.
 */
@Slf4j
@Component
public class ResolvedFactAuditor implements ResolvedFactListener {

    private final Counter factsCounter;
    private final Counter bytesCounter;
    private final AtomicLong resolvedCount = new AtomicLong();
    private final AtomicReference<ResolvedFact> lastResolved = new AtomicReference<>();

    public ResolvedFactAuditor(MeterRegistry meterRegistry) {
        this.factsCounter = meterRegistry.counter("starksync.facts.audited");
        this.bytesCounter = meterRegistry.counter("starksync.facts.page.bytes");
    }

    @Override
    public void onResolved(ResolvedFact fact) {
        resolvedCount.incrementAndGet();
        lastResolved.set(fact);
        factsCounter.increment();
        bytesCounter.increment(fact.totalBytes());
        log.info("Fact resolved: fact={}, pages={}, bytes={}", fact.factHash(), fact.pageCount(), fact.totalBytes());
    }

    public long getResolvedCount() {
        return resolvedCount.get();
    }

    public Optional<ResolvedFact> getLastResolved() {
        return Optional.ofNullable(lastResolved.get());
    }
}
