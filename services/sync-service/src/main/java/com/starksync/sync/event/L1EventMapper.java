package com.starksync.sync.event;

import com.starksync.common.exception.EventDecodeException;
import com.starksync.common.exception.SyncErrorCode;
import com.starksync.sync.l1.Hash32;
import com.starksync.sync.l1.L1Log;
import com.starksync.sync.l1.WatchedContract;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.starksync.sync.abi.StarknetAbiDecoder.FACT_HASH;
import static com.starksync.sync.abi.StarknetAbiDecoder.MEMORY_HASH;
import static com.starksync.sync.abi.StarknetAbiDecoder.PAGES_HASHES;
import static com.starksync.sync.abi.StarknetAbiDecoder.PRIME;
import static com.starksync.sync.abi.StarknetAbiDecoder.STATE_TRANSITION_FACT;

/**
 * Turns decoded field maps into typed events. Field names are only looked up here.
 */
public class L1EventMapper {

    public L1Event map(WatchedContract contract, L1Log log, Map<String, Object> fields) {
        String event = contract.getEventName();
        return switch (contract) {
            case STATE -> new StateTransitionFactEvent(
                    bytes32(event, fields, STATE_TRANSITION_FACT),
                    log.blockNumber(), log.logIndex());
            case GPS_VERIFIER -> new MemoryPagesHashesEvent(
                    bytes32(event, fields, FACT_HASH),
                    bytes32List(event, fields, PAGES_HASHES),
                    log.blockNumber(), log.logIndex());
            case MEMORY_PAGE_REGISTRY -> new MemoryPageFactEvent(
                    bytes32(event, fields, FACT_HASH),
                    Hash32.fromBigInteger(bigInteger(event, fields, MEMORY_HASH)),
                    bigInteger(event, fields, PRIME),
                    log.transactionHash(),
                    log.blockNumber(), log.logIndex());
        };
    }

    private static Hash32 bytes32(String event, Map<String, Object> fields, String name) {
        return toHash(event, name, require(event, fields, name));
    }

    private static List<Hash32> bytes32List(String event, Map<String, Object> fields, String name) {
        if (!(require(event, fields, name) instanceof List<?> values)) {
            throw unexpected(event, name, "expected a list");
        }
        List<Hash32> hashes = new ArrayList<>(values.size());
        for (Object value : values) {
            hashes.add(toHash(event, name, value));
        }
        return hashes;
    }

    private static BigInteger bigInteger(String event, Map<String, Object> fields, String name) {
        Object value = require(event, fields, name);
        if (value instanceof BigInteger number) {
            return number;
        }
        if (value instanceof byte[] raw) {
            return new BigInteger(1, raw);
        }
        throw unexpected(event, name, "expected an integer, got " + value.getClass().getSimpleName());
    }

    private static Hash32 toHash(String event, String name, Object value) {
        if (value instanceof byte[] raw && raw.length == Hash32.LENGTH) {
            return Hash32.of(raw);
        }
        if (value instanceof Hash32 hash) {
            return hash;
        }
        throw unexpected(event, name, "expected 32 bytes");
    }

    private static Object require(String event, Map<String, Object> fields, String name) {
        Object value = fields.get(name);
        if (value == null) {
            throw unexpected(event, name, "missing");
        }
        return value;
    }

    private static EventDecodeException unexpected(String event, String field, String problem) {
        return new EventDecodeException(SyncErrorCode.DECODE_UNEXPECTED_FIELD, event,
                "Field " + field + " " + problem);
    }
}
