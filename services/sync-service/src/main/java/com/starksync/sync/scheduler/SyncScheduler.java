package com.starksync.sync.scheduler;

import com.starksync.sync.fact.FactResolver;
import com.starksync.sync.state.StateSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled jobs for the sync service
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SyncScheduler {

    private final FactResolver factResolver;
    private final StateSyncService stateSyncService;

    /**
     * Resolve facts whose pages are known
     * Runs every 5 seconds by default
     */
    @Scheduled(fixedDelayString = "${starksync.facts.poll-interval-ms:5000}")
    public void resolveFacts() {
        log.debug("=== Scheduled Job: Resolve Pending Facts ===");
        try {
            factResolver.resolvePending();
        } catch (Exception e) {
            log.error("Error resolving pending facts", e);
        }
    }

    /**
     * Materialize new L2 blocks
     * Runs every 2 minutes by default
     */
    @Scheduled(fixedDelayString = "${starksync.state.poll-interval-ms:120000}")
    public void syncState() {
        log.debug("=== Scheduled Job: Sync L2 State ===");
        try {
            stateSyncService.syncAvailableBlocks();
        } catch (Exception e) {
            log.error("Error syncing L2 state", e);
        }
    }
}
