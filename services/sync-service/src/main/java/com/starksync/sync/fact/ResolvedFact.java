package com.starksync.sync.fact;

import com.starksync.sync.l1.Hash32;

import java.util.List;

/**
 * A fully resolved fact: the raw memory pages in the order the verifier listed them.
 */
public record ResolvedFact(Hash32 factHash, List<byte[]> pages) {

    public ResolvedFact {
        pages = pages.stream().map(byte[]::clone).toList();
    }

    public int pageCount() {
        return pages.size();
    }

    public long totalBytes() {
        return pages.stream().mapToLong(page -> page.length).sum();
    }
}
