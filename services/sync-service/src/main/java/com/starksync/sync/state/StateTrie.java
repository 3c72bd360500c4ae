package com.starksync.sync.state;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Height-251 Merkle-Patricia trie keyed and valued by field elements.
 * Writes are idempotent: putting the same value twice leaves the root unchanged.
 */
public interface StateTrie {

    Optional<BigInteger> get(BigInteger key);

    void put(BigInteger key, BigInteger value);

    BigInteger root();
}
