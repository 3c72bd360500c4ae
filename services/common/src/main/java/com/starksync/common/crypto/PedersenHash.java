package com.starksync.common.crypto;

import com.starksync.common.exception.CommitmentException;
import com.starksync.common.exception.SyncErrorCode;
import org.bouncycastle.math.ec.ECPoint;

import java.math.BigInteger;

/**
 * StarkWare's Pedersen hash over the STARK curve.
 *
 * <p>{@code digest(a, b)} is the x coordinate of
 * {@code shift + a_low*P1 + a_high*P2 + b_low*P3 + b_high*P4}, where
 * {@code _low} is the low 248 bits and {@code _high} the remaining 4 bits.
 * Points are added one bit at a time in the reference order so that the
 * "unhashable input" condition is raised on exactly the same inputs.
 */
public final class PedersenHash {

    static final int LOW_PART_BITS = 248;
    static final int HIGH_PART_BITS = 4;
    static final int ELEMENT_BITS = LOW_PART_BITS + HIGH_PART_BITS;

    // Doublings of P1..P4, one 252-entry row per hashed element
    private static final ECPoint[][] CONSTANT_POINTS = {
            powersOfTwo(StarkCurve.P1, StarkCurve.P2),
            powersOfTwo(StarkCurve.P3, StarkCurve.P4)
    };

    private PedersenHash() {
    }

    /**
     * Hashes two field elements.
     *
     * @throws CommitmentException if an input is outside {@code [0, P)} or unhashable
     */
    public static BigInteger digest(BigInteger a, BigInteger b) {
        ECPoint point = StarkCurve.SHIFT_POINT;
        point = accumulate(point, a, CONSTANT_POINTS[0]);
        point = accumulate(point, b, CONSTANT_POINTS[1]);
        return point.getAffineXCoord().toBigInteger();
    }

    /**
     * Chains {@link #digest} over the elements starting from zero and folds in
     * the element count last. An empty input hashes to {@code digest(0, 0)}.
     */
    public static BigInteger arrayDigest(BigInteger... elements) {
        BigInteger result = BigInteger.ZERO;
        for (BigInteger element : elements) {
            result = digest(result, element);
        }
        return digest(result, BigInteger.valueOf(elements.length));
    }

    private static ECPoint accumulate(ECPoint start, BigInteger element, ECPoint[] constants) {
        FieldElements.requireInField(element);
        ECPoint point = start;
        BigInteger remaining = element;
        for (ECPoint constant : constants) {
            BigInteger x = point.getAffineXCoord().toBigInteger();
            if (x.equals(constant.getAffineXCoord().toBigInteger())) {
                throw new CommitmentException(SyncErrorCode.COMMIT_UNHASHABLE_INPUT,
                        "Unhashable input: " + FieldElements.toHex(element));
            }
            if (remaining.testBit(0)) {
                point = point.add(constant).normalize();
            }
            remaining = remaining.shiftRight(1);
        }
        return point;
    }

    private static ECPoint[] powersOfTwo(ECPoint low, ECPoint high) {
        ECPoint[] points = new ECPoint[ELEMENT_BITS];
        ECPoint current = low;
        for (int i = 0; i < LOW_PART_BITS; i++) {
            points[i] = current;
            current = current.twice().normalize();
        }
        current = high;
        for (int i = 0; i < HIGH_PART_BITS; i++) {
            points[LOW_PART_BITS + i] = current;
            current = current.twice().normalize();
        }
        return points;
    }
}
