package com.starksync.common.crypto;

import com.starksync.common.exception.CommitmentException;
import com.starksync.common.exception.SyncErrorCode;

import java.math.BigInteger;
import java.util.Locale;

/**
 * Parsing and formatting of STARK field elements.
 */
public final class FieldElements {

    private FieldElements() {
    }

    /**
     * Parses a hex string, with or without a {@code 0x} prefix.
     */
    public static BigInteger fromHex(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Field element hex string is empty");
        }
        String digits = value.startsWith("0x") || value.startsWith("0X") ? value.substring(2) : value;
        if (digits.isEmpty()) {
            return BigInteger.ZERO;
        }
        return new BigInteger(digits, 16);
    }

    /**
     * Formats as {@code 0x}-prefixed lowercase hex without leading zeros.
     */
    public static String toHex(BigInteger value) {
        return "0x" + value.toString(16).toLowerCase(Locale.ROOT);
    }

    /**
     * Big-endian 32-byte encoding.
     */
    public static byte[] toBytes32(BigInteger value) {
        if (value.signum() < 0 || value.bitLength() > 256) {
            throw new IllegalArgumentException("Value does not fit in 32 bytes: " + value);
        }
        byte[] raw = value.toByteArray();
        byte[] out = new byte[32];
        int copy = Math.min(raw.length, 32);
        System.arraycopy(raw, raw.length - copy, out, 32 - copy, copy);
        return out;
    }

    public static BigInteger fromBytes(byte[] bytes) {
        return new BigInteger(1, bytes);
    }

    static void requireInField(BigInteger value) {
        if (value == null || value.signum() < 0 || value.compareTo(StarkCurve.FIELD_PRIME) >= 0) {
            throw new CommitmentException(SyncErrorCode.COMMIT_INPUT_OUT_OF_RANGE,
                    "Field element out of range: " + (value == null ? "null" : toHex(value)));
        }
    }
}
