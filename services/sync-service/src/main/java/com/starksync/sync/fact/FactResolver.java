package com.starksync.sync.fact;

import com.starksync.common.exception.L1TransportException;
import com.starksync.common.exception.SyncErrorCode;
import com.starksync.sync.l1.L1Client;
import com.starksync.sync.l1.L1Transaction;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * Drains the pending-fact queue: claims each ready fact, fetches the
 * transactions carrying its pages and hands the result to the listeners.
 *
 * <p>Fetches happen outside the registry lock. A fact whose fetch fails goes
 * back to the front of the queue and the current pass stops, so the next pass
 * starts with it again.
 */
@Slf4j
public class FactResolver {

    private final FactRegistry registry;
    private final L1Client l1Client;
    private final Retry retry;
    private final List<ResolvedFactListener> listeners;
    private final Counter resolvedCounter;
    private final Counter fetchFailureCounter;

    public FactResolver(FactRegistry registry,
                        L1Client l1Client,
                        Retry retry,
                        List<ResolvedFactListener> listeners,
                        MeterRegistry meterRegistry) {
        this.registry = registry;
        this.l1Client = l1Client;
        this.retry = retry;
        this.listeners = List.copyOf(listeners);
        this.resolvedCounter = meterRegistry.counter("starksync.facts.resolved");
        this.fetchFailureCounter = meterRegistry.counter("starksync.facts.fetch.failures");
    }

    /**
     * Resolves every fact that is ready, in queue order.
     *
     * @return number of facts resolved in this pass
     */
    public int resolvePending() {
        int resolved = 0;
        while (true) {
            var claim = registry.claimNext();
            if (claim.isEmpty() || !resolve(claim.get())) {
                break;
            }
            resolved++;
        }
        if (resolved > 0) {
            log.info("Resolved {} facts, pending={}", resolved, registry.pendingCount());
        }
        return resolved;
    }

    private boolean resolve(ClaimedFact claim) {
        MDC.put("fact", claim.factHash().toHex());
        try {
            List<byte[]> pages = new ArrayList<>(claim.pages().size());
            for (ClaimedFact.PageLocation page : claim.pages()) {
                L1Transaction transaction = retry.executeSupplier(() -> fetch(page));
                pages.add(transaction.input());
            }
            registry.markResolved(claim.factHash());
            resolvedCounter.increment();
            publish(new ResolvedFact(claim.factHash(), pages));
            return true;
        } catch (L1TransportException e) {
            fetchFailureCounter.increment();
            log.warn("Fact resolution deferred: operation={}, fact={}, error={}",
                    e.getOperation(), claim.factHash(), e.getMessage());
            registry.release(claim.factHash());
            return false;
        } catch (RuntimeException e) {
            registry.release(claim.factHash());
            throw e;
        } finally {
            MDC.remove("fact");
        }
    }

    private L1Transaction fetch(ClaimedFact.PageLocation page) {
        return l1Client.transactionByHash(page.transactionHash())
                .orElseThrow(() -> new L1TransportException(SyncErrorCode.L1_TRANSACTION_NOT_FOUND,
                        "transactionByHash",
                        "Transaction " + page.transactionHash() + " for page " + page.pageHash() + " not found",
                        null));
    }

    private void publish(ResolvedFact fact) {
        for (ResolvedFactListener listener : listeners) {
            try {
                listener.onResolved(fact);
            } catch (RuntimeException e) {
                log.error("Resolved-fact listener failed: listener={}, fact={}",
                        listener.getClass().getSimpleName(), fact.factHash(), e);
            }
        }
    }
}
