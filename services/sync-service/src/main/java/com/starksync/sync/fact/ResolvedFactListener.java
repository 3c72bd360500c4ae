package com.starksync.sync.fact;

/**
 * Receives each fact once all of its pages have been fetched.
 */
public interface ResolvedFactListener {

    void onResolved(ResolvedFact fact);
}
