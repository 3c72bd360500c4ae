package com.starksync.sync.feeder;

import java.math.BigInteger;

/**
 * One storage write: {@code key} and {@code value} are field elements.
 */
public record StorageEntry(BigInteger key, BigInteger value) {
}
