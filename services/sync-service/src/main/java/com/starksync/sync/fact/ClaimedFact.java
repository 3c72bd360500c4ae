package com.starksync.sync.fact;

import com.starksync.sync.l1.Hash32;

import java.util.List;

/**
 * A fact taken off the pending queue together with where each of its pages lives.
 */
public record ClaimedFact(Hash32 factHash, List<PageLocation> pages) {

    public ClaimedFact {
        pages = List.copyOf(pages);
    }

    public record PageLocation(Hash32 pageHash, Hash32 transactionHash) {
    }
}
