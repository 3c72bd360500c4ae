package com.starksync.sync.support;

import com.starksync.sync.l1.Hash32;
import com.starksync.sync.l1.L1Log;
import com.starksync.sync.l1.WatchedContract;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.List;

/**
 * Builds ABI-encoded logs for the watched events.
 */
public final class TestLogs {

    public static final String STATE_ADDRESS = "0xc662c410c0ecf747543f5ba90660f6abebd9c8c4";
    public static final String GPS_ADDRESS = "0xa739b175325cca7b71fcb51c3032935ef7ac338f";
    public static final String REGISTRY_ADDRESS = "0x96375087b2f6efc59e5e0dd5111b4d090ebfdd8b";

    public static final BigInteger PRIME = BigInteger.TWO.pow(251)
            .add(BigInteger.valueOf(17).multiply(BigInteger.TWO.pow(192)))
            .add(BigInteger.ONE);

    private TestLogs() {
    }

    public static Hash32 hash(long value) {
        return Hash32.fromBigInteger(BigInteger.valueOf(value));
    }

    public static L1Log stateFact(Hash32 fact, long block, long logIndex) {
        return log(STATE_ADDRESS, WatchedContract.STATE, encode(fact.toBigInteger()), block, logIndex);
    }

    public static L1Log pagesHashes(Hash32 fact, List<Hash32> pages, long block, long logIndex) {
        BigInteger[] words = new BigInteger[3 + pages.size()];
        words[0] = fact.toBigInteger();
        words[1] = BigInteger.valueOf(64);
        words[2] = BigInteger.valueOf(pages.size());
        for (int i = 0; i < pages.size(); i++) {
            words[3 + i] = pages.get(i).toBigInteger();
        }
        return log(GPS_ADDRESS, WatchedContract.GPS_VERIFIER, encode(words), block, logIndex);
    }

    public static L1Log memoryPage(Hash32 fact, Hash32 page, long block, long logIndex) {
        return log(REGISTRY_ADDRESS, WatchedContract.MEMORY_PAGE_REGISTRY,
                encode(fact.toBigInteger(), page.toBigInteger(), PRIME), block, logIndex);
    }

    public static L1Log log(String address, WatchedContract contract, byte[] data, long block, long logIndex) {
        return new L1Log(address, List.of(contract.getTopic()), data, block, hash(block),
                transactionHash(block, logIndex), logIndex, false);
    }

    public static L1Log removed(L1Log log) {
        return new L1Log(log.address(), log.topics(), log.data(), log.blockNumber(), log.blockHash(),
                log.transactionHash(), log.logIndex(), true);
    }

    public static Hash32 transactionHash(long block, long logIndex) {
        return hash(block * 1_000 + logIndex + 0xabc000000L);
    }

    public static byte[] encode(BigInteger... words) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (BigInteger word : words) {
            out.writeBytes(Hash32.fromBigInteger(word).toBytes());
        }
        return out.toByteArray();
    }
}
