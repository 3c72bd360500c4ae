package com.starksync.sync.state;

import com.starksync.common.crypto.PedersenHash;
import com.starksync.common.exception.CommitmentException;

import java.math.BigInteger;

/**
 * Leaf value of a contract in the state trie:
 * {@code h(h(h(contractHash, storageRoot), 0), 0)}.
 */
public final class ContractStateCommitment {

    private ContractStateCommitment() {
    }

    public static BigInteger compute(BigInteger contractHash, BigInteger storageRoot) {
        BigInteger step1 = step(1, contractHash, storageRoot);
        BigInteger step2 = step(2, step1, BigInteger.ZERO);
        return step(3, step2, BigInteger.ZERO);
    }

    private static BigInteger step(int index, BigInteger a, BigInteger b) {
        try {
            return PedersenHash.digest(a, b);
        } catch (CommitmentException e) {
            throw new CommitmentException(e.getErrorCode(),
                    "Contract commitment failed at step " + index + ": " + e.getMessage(), e);
        }
    }
}
