package com.starksync.sync.abi;

import com.starksync.common.exception.EventDecodeException;
import com.starksync.sync.l1.L1Log;
import com.starksync.sync.l1.WatchedContract;

import java.util.Map;

/**
 * Decodes a raw log emitted by a watched contract into its named fields.
 *
 * <p>Values are {@code byte[]} for fixed-size byte arrays, {@code List<byte[]>}
 * for byte-array lists and {@link java.math.BigInteger} for integers.
 */
public interface EventDecoder {

    Map<String, Object> decode(WatchedContract contract, L1Log log) throws EventDecodeException;
}
