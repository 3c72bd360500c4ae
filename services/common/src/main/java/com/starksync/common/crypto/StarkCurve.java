package com.starksync.common.crypto;

import org.bouncycastle.math.ec.ECCurve;
import org.bouncycastle.math.ec.ECPoint;

import java.math.BigInteger;

/**
 * The STARK-friendly elliptic curve {@code y^2 = x^3 + alpha*x + beta} over the
 * prime field {@code P = 2^251 + 17*2^192 + 1}, together with the Pedersen
 * constant points published by StarkWare.
 */
public final class StarkCurve {

    public static final BigInteger FIELD_PRIME = BigInteger.TWO.pow(251)
            .add(BigInteger.valueOf(17).multiply(BigInteger.TWO.pow(192)))
            .add(BigInteger.ONE);

    public static final BigInteger ALPHA = BigInteger.ONE;

    public static final BigInteger BETA =
            hex("6f21413efbe40de150e596d72f7a8c5609ad26c15c915c1f4cdfcb99cee9e89");

    public static final BigInteger ORDER =
            hex("800000000000010ffffffffffffffffb781126dcae7b2321e66a241adc64d2f");

    public static final ECCurve CURVE = new ECCurve.Fp(FIELD_PRIME, ALPHA, BETA, ORDER, BigInteger.ONE);

    /** Starting point of every Pedersen hash. */
    public static final ECPoint SHIFT_POINT = point(
            "49ee3eba8c1600700ee1b87eb599f16716b0b1022947733551fde4050ca6804",
            "3ca0cfe4b3bc6ddf346d49d06ea0ed34e621062c0e056c1d0405d266e10268a");

    static final ECPoint P1 = point(
            "234287dcbaffe7f969c748655fca9e58fa8120b6d56eb0c1080d17957ebe47b",
            "3b056f100f96fb21e889527d41f4e39940135dd7a6c94cc6ed0268ee89e5615");

    static final ECPoint P2 = point(
            "4fa56f376c83db33f9dab2656558f3399099ec1de5e3018b7a6932dba8aa378",
            "3fa0984c931c9e38113e0c0e47e4401562761f92a7a23b45168f4e80ff5b54d");

    static final ECPoint P3 = point(
            "4ba4cc166be8dec764910f75b45f74b40c690c74709e90f3aa372f0bd2d6997",
            "40301cf5c1751f4b971e46c4ede85fcac5c59a5ce5ae7c48151f27b24b219c");

    static final ECPoint P4 = point(
            "54302dcb0e6cc1c6e44cca8f61a63bb2ca65048d53fb325d36ff12c49a58202",
            "1b77b3e37d13504b348046268d8ae25ce98ad783c25561a879dcc77e99c2426");

    private StarkCurve() {
    }

    private static ECPoint point(String x, String y) {
        ECPoint point = CURVE.createPoint(hex(x), hex(y));
        if (!point.isValid()) {
            throw new IllegalStateException("Constant point is not on the STARK curve: x=0x" + x);
        }
        return point;
    }

    private static BigInteger hex(String value) {
        return new BigInteger(value, 16);
    }
}
