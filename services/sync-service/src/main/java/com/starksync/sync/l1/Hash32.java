package com.starksync.sync.l1;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Immutable 32-byte value: fact hashes, page hashes, transaction hashes and topics.
 */
public final class Hash32 implements Comparable<Hash32> {

    public static final int LENGTH = 32;

    public static final Hash32 ZERO = new Hash32(new byte[LENGTH]);

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] bytes;

    private Hash32(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Hash32 of(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Expected 32 bytes, got "
                    + (bytes == null ? "null" : bytes.length));
        }
        return new Hash32(bytes.clone());
    }

    public static Hash32 fromHex(String hex) {
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (digits.length() > LENGTH * 2) {
            throw new IllegalArgumentException("Hex value longer than 32 bytes: " + hex);
        }
        String padded = "0".repeat(LENGTH * 2 - digits.length()) + digits;
        return new Hash32(HEX.parseHex(padded));
    }

    /**
     * Big-endian encoding of a non-negative integer below 2^256.
     */
    public static Hash32 fromBigInteger(BigInteger value) {
        if (value.signum() < 0 || value.bitLength() > LENGTH * 8) {
            throw new IllegalArgumentException("Value does not fit in 32 bytes: " + value);
        }
        byte[] raw = value.toByteArray();
        byte[] out = new byte[LENGTH];
        int copy = Math.min(raw.length, LENGTH);
        System.arraycopy(raw, raw.length - copy, out, LENGTH - copy, copy);
        return new Hash32(out);
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public BigInteger toBigInteger() {
        return new BigInteger(1, bytes);
    }

    public String toHex() {
        return "0x" + HEX.formatHex(bytes);
    }

    @Override
    public int compareTo(Hash32 other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Hash32 other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
