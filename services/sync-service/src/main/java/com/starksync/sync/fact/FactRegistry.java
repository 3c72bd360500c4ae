package com.starksync.sync.fact;

import com.starksync.common.concurrent.ConcurrencyUtils;
import com.starksync.common.concurrent.LookupTable;
import com.starksync.sync.event.L1Event;
import com.starksync.sync.event.MemoryPageFactEvent;
import com.starksync.sync.event.MemoryPagesHashesEvent;
import com.starksync.sync.event.StateTransitionFactEvent;
import com.starksync.sync.l1.Hash32;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pending-fact queue and the two lookup tables that resolve a fact to the L1
 * transactions carrying its pages:
 * <pre>
 *   fact -> [page hash, ...]        (proof verifier)
 *   page hash -> transaction hash   (memory page registry)
 * </pre>
 * Every record goes to the {@link FactJournal} before memory changes, so an
 * applied event survives a restart and re-applying it is a no-op.
 *
 * <p>Memory holds only the facts still queued or being resolved, with their
 * page sets and known page transactions. Entries are evicted once the fact
 * is resolved; later sightings are deduplicated against the journal.
 * Queue, tables and status share a single lock. Journal writes happen under
 * it; transaction fetches never do.
 */
@Slf4j
public class FactRegistry {

    private final ReentrantLock lock = new ReentrantLock();
    private final FactJournal journal;
    private final boolean strictOrdering;

    private final Deque<Hash32> pending = new ArrayDeque<>();
    private final Set<Hash32> resolving = new HashSet<>();
    // Observation order of queued and resolving facts, as persisted
    private final Set<Hash32> tracked = new LinkedHashSet<>();
    private final LookupTable<Hash32, List<Hash32>> factPages = new LookupTable<>("factPages", lock);
    private final LookupTable<Hash32, Hash32> pageTransactions = new LookupTable<>("pageTransactions", lock);
    private final Map<Hash32, Integer> pageReferences = new HashMap<>();

    public FactRegistry(FactJournal journal, boolean strictOrdering) {
        this.journal = journal;
        this.strictOrdering = strictOrdering;
    }

    /**
     * Reloads the stored queue with whatever is known about each fact's pages.
     *
     * @return number of facts put back in the queue
     */
    public int restore() {
        return ConcurrencyUtils.withLock(lock, () -> {
            int restored = 0;
            for (Hash32 factHash : journal.loadQueue()) {
                if (tracked.contains(factHash) || journal.isResolved(factHash)) {
                    continue;
                }
                pending.addLast(factHash);
                tracked.add(factHash);
                journal.findPages(factHash).ifPresent(pages -> attachPages(factHash, pages));
                restored++;
            }
            log.info("Fact registry restored: pending={}, pageSets={}, pageTransactions={}",
                    restored, factPages.size(), pageTransactions.size());
            return restored;
        });
    }

    public void apply(L1Event event) {
        if (event instanceof StateTransitionFactEvent fact) {
            observeFact(fact.factHash());
        } else if (event instanceof MemoryPagesHashesEvent pages) {
            recordPages(pages.factHash(), pages.pagesHashes());
        } else if (event instanceof MemoryPageFactEvent page) {
            recordPageTransaction(page.memoryHash(), page.transactionHash());
        } else {
            log.warn("Ignoring unsupported event type: {}", event.getClass().getSimpleName());
        }
    }

    /**
     * Appends a newly seen fact to the pending queue.
     *
     * @return false if the fact is already queued or was resolved before
     */
    public boolean observeFact(Hash32 factHash) {
        return ConcurrencyUtils.withLock(lock, () -> {
            if (tracked.contains(factHash)) {
                log.debug("Fact already queued: fact={}", factHash);
                return false;
            }
            if (journal.isResolved(factHash)) {
                log.debug("Fact already resolved: fact={}", factHash);
                return false;
            }
            List<Hash32> queue = new ArrayList<>(tracked);
            queue.add(factHash);
            journal.saveQueue(queue);

            pending.addLast(factHash);
            tracked.add(factHash);
            journal.findPages(factHash).ifPresent(pages -> attachPages(factHash, pages));
            log.debug("Fact observed: fact={}, pending={}", factHash, pending.size());
            return true;
        });
    }

    public boolean recordPages(Hash32 factHash, List<Hash32> pageHashes) {
        List<Hash32> pages = List.copyOf(pageHashes);
        return ConcurrencyUtils.withLock(lock, () -> {
            if (journal.isResolved(factHash)) {
                log.debug("Ignoring pages of resolved fact: fact={}", factHash);
                return false;
            }
            if (!journal.recordPages(factHash, pages)) {
                return false;
            }
            if (tracked.contains(factHash)) {
                attachPages(factHash, pages);
            }
            return true;
        });
    }

    public boolean recordPageTransaction(Hash32 pageHash, Hash32 transactionHash) {
        return ConcurrencyUtils.withLock(lock, () -> {
            if (!journal.recordTransaction(pageHash, transactionHash)) {
                return false;
            }
            if (pageReferences.containsKey(pageHash)) {
                pageTransactions.add(pageHash, transactionHash);
            }
            return true;
        });
    }

    /**
     * Takes the next fact whose page set and every page's transaction are known.
     * In strict mode only the head of the queue is eligible.
     */
    public Optional<ClaimedFact> claimNext() {
        return ConcurrencyUtils.withLock(lock, () -> {
            Iterator<Hash32> it = pending.iterator();
            while (it.hasNext()) {
                Hash32 candidate = it.next();
                Optional<ClaimedFact> claim = locate(candidate);
                if (claim.isPresent()) {
                    it.remove();
                    resolving.add(candidate);
                    return claim;
                }
                if (strictOrdering) {
                    break;
                }
            }
            return Optional.empty();
        });
    }

    /**
     * Puts a claimed fact back at the front of the queue after a failed fetch.
     */
    public void release(Hash32 factHash) {
        ConcurrencyUtils.withLockVoid(lock, () -> {
            if (resolving.remove(factHash)) {
                pending.addFirst(factHash);
            }
        });
    }

    /**
     * Records the fact as resolved and discards everything held for it.
     */
    public void markResolved(Hash32 factHash) {
        ConcurrencyUtils.withLockVoid(lock, () -> {
            if (!resolving.contains(factHash)) {
                log.warn("Ignoring resolution of unclaimed fact: fact={}", factHash);
                return;
            }
            List<Hash32> remaining = new ArrayList<>(tracked);
            remaining.remove(factHash);
            journal.markResolved(factHash, remaining);

            resolving.remove(factHash);
            tracked.remove(factHash);
            detachPages(factHash);
        });
    }

    public Optional<FactStatus> status(Hash32 factHash) {
        return ConcurrencyUtils.withLock(lock, () -> {
            if (resolving.contains(factHash)) {
                return Optional.of(FactStatus.RESOLVING);
            }
            if (tracked.contains(factHash)) {
                return Optional.of(factPages.exists(factHash) ? FactStatus.PAGES_KNOWN : FactStatus.OBSERVED);
            }
            if (journal.isResolved(factHash)) {
                return Optional.of(FactStatus.RESOLVED);
            }
            return Optional.empty();
        });
    }

    public int pendingCount() {
        return ConcurrencyUtils.withLock(lock, pending::size);
    }

    public List<Hash32> pendingFacts() {
        return ConcurrencyUtils.withLock(lock, () -> List.copyOf(pending));
    }

    /**
     * Number of page sets and page transactions held in memory.
     */
    public int heldEntries() {
        return ConcurrencyUtils.withLock(lock, () -> factPages.size() + pageTransactions.size());
    }

    public boolean isStrictOrdering() {
        return strictOrdering;
    }

    private void attachPages(Hash32 factHash, List<Hash32> pages) {
        if (!factPages.add(factHash, pages)) {
            return;
        }
        for (Hash32 page : pages) {
            pageReferences.merge(page, 1, Integer::sum);
            if (!pageTransactions.exists(page)) {
                journal.findTransaction(page).ifPresent(tx -> pageTransactions.add(page, tx));
            }
        }
    }

    private void detachPages(Hash32 factHash) {
        factPages.remove(factHash).ifPresent(pages -> {
            for (Hash32 page : pages) {
                Integer left = pageReferences.computeIfPresent(page, (p, count) -> count > 1 ? count - 1 : null);
                if (left == null) {
                    pageTransactions.remove(page);
                }
            }
        });
    }

    private Optional<ClaimedFact> locate(Hash32 factHash) {
        Optional<List<Hash32>> pages = factPages.get(factHash);
        if (pages.isEmpty()) {
            return Optional.empty();
        }
        List<ClaimedFact.PageLocation> locations = new ArrayList<>(pages.get().size());
        for (Hash32 page : pages.get()) {
            Optional<Hash32> transaction = pageTransactions.get(page);
            if (transaction.isEmpty()) {
                return Optional.empty();
            }
            locations.add(new ClaimedFact.PageLocation(page, transaction.get()));
        }
        return Optional.of(new ClaimedFact(factHash, locations));
    }
}
