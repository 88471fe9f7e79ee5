package com.silentrisk.vault.model.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * An opaque 32-byte word: commitment hashes, nullifier hashes and encrypted score handles.
 */
public final class Bytes32 {

    public static final int LENGTH = 32;

    public static final Bytes32 ZERO = new Bytes32(new byte[LENGTH]);

    private final byte[] bytes;

    private Bytes32(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Bytes32 wrap(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Expected 32 bytes, got " + (bytes == null ? "null" : bytes.length));
        }
        return new Bytes32(bytes.clone());
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Bytes32 fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("Hex value must not be null");
        }
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (digits.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Expected 64 hex digits, got " + digits.length());
        }
        try {
            return new Bytes32(Hex.decode(digits));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid hex value: " + hex, e);
        }
    }

    /**
     * Left-pads a non-negative integer into a 32-byte big-endian word.
     */
    public static Bytes32 fromUnsigned(BigInteger value) {
        if (value.signum() < 0 || value.bitLength() > LENGTH * 8) {
            throw new IllegalArgumentException("Value does not fit in 32 unsigned bytes: " + value);
        }
        byte[] raw = value.toByteArray();
        byte[] padded = new byte[LENGTH];
        int srcPos = Math.max(0, raw.length - LENGTH);
        int length = raw.length - srcPos;
        System.arraycopy(raw, srcPos, padded, LENGTH - length, length);
        return new Bytes32(padded);
    }

    public static Bytes32 fromUnsigned(long value) {
        return fromUnsigned(BigInteger.valueOf(value));
    }

    public BigInteger toUnsigned() {
        return new BigInteger(1, bytes);
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public boolean isZero() {
        return Arrays.equals(bytes, ZERO.bytes);
    }

    @JsonValue
    public String toHex() {
        return "0x" + Hex.toHexString(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bytes32)) return false;
        return Arrays.equals(bytes, ((Bytes32) o).bytes);
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
