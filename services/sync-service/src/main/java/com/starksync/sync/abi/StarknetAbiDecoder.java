package com.starksync.sync.abi;

import com.starksync.common.exception.EventDecodeException;
import com.starksync.common.exception.SyncErrorCode;
import com.starksync.sync.l1.L1Log;
import com.starksync.sync.l1.WatchedContract;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ABI decoder for the three watched StarkNet events. None of their fields are
 * indexed, so everything is read from the log data:
 * <ul>
 *   <li>{@code LogStateTransitionFact(bytes32 stateTransitionFact)}</li>
 *   <li>{@code LogMemoryPagesHashes(bytes32 factHash, bytes32[] pagesHashes)}</li>
 *   <li>{@code LogMemoryPageFactContinuous(bytes32 factHash, uint256 memoryHash, uint256 prime)}</li>
 * </ul>
 */
public class StarknetAbiDecoder implements EventDecoder {

    public static final String STATE_TRANSITION_FACT = "stateTransitionFact";
    public static final String FACT_HASH = "factHash";
    public static final String PAGES_HASHES = "pagesHashes";
    public static final String MEMORY_HASH = "memoryHash";
    public static final String PRIME = "prime";

    private static final int WORD = 32;

    @Override
    public Map<String, Object> decode(WatchedContract contract, L1Log log) {
        if (log.topics().isEmpty() || !log.topics().get(0).equals(contract.getTopic())) {
            throw new EventDecodeException(SyncErrorCode.DECODE_UNEXPECTED_FIELD, contract.getEventName(),
                    "Topic 0 does not match event signature, topics=" + log.topics());
        }
        byte[] data = log.data();
        if (data.length % WORD != 0) {
            throw malformed(contract, "Data length " + data.length + " is not a multiple of 32");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        switch (contract) {
            case STATE -> {
                requireWords(contract, data, 1);
                fields.put(STATE_TRANSITION_FACT, word(data, 0));
            }
            case GPS_VERIFIER -> {
                requireWords(contract, data, 2);
                fields.put(FACT_HASH, word(data, 0));
                fields.put(PAGES_HASHES, dynamicWordArray(contract, data, 1));
            }
            case MEMORY_PAGE_REGISTRY -> {
                requireWords(contract, data, 3);
                fields.put(FACT_HASH, word(data, 0));
                fields.put(MEMORY_HASH, new BigInteger(1, word(data, 1)));
                fields.put(PRIME, new BigInteger(1, word(data, 2)));
            }
        }
        return fields;
    }

    private List<byte[]> dynamicWordArray(WatchedContract contract, byte[] data, int headSlot) {
        long offset = uint(contract, data, headSlot);
        if (offset % WORD != 0 || offset + WORD > data.length) {
            throw malformed(contract, "Array offset " + offset + " out of bounds");
        }
        int lengthSlot = (int) (offset / WORD);
        long length = uint(contract, data, lengthSlot);
        long available = data.length / WORD - lengthSlot - 1L;
        if (length > available) {
            throw malformed(contract, "Array length " + length + " exceeds the " + available + " words present");
        }
        List<byte[]> values = new ArrayList<>((int) length);
        for (int i = 0; i < length; i++) {
            values.add(word(data, lengthSlot + 1 + i));
        }
        return values;
    }

    private long uint(WatchedContract contract, byte[] data, int slot) {
        BigInteger value = new BigInteger(1, word(data, slot));
        if (value.bitLength() > 31) {
            throw malformed(contract, "Integer in slot " + slot + " is too large: " + value);
        }
        return value.longValue();
    }

    private static byte[] word(byte[] data, int slot) {
        return Arrays.copyOfRange(data, slot * WORD, (slot + 1) * WORD);
    }

    private static void requireWords(WatchedContract contract, byte[] data, int words) {
        if (data.length < words * WORD) {
            throw malformed(contract, "Expected at least " + words + " words, got " + data.length / WORD);
        }
    }

    private static EventDecodeException malformed(WatchedContract contract, String message) {
        return new EventDecodeException(SyncErrorCode.DECODE_MALFORMED_EVENT, contract.getEventName(), message);
    }
}
