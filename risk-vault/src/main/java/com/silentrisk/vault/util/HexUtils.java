package com.silentrisk.vault.util;

import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

public final class HexUtils {

    private HexUtils() {
    }

    /**
     * Decodes a hex string with or without a 0x prefix. Null decodes to null.
     */
    public static byte[] decode(String hex) {
        if (hex == null) {
            return null;
        }
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (digits.length() % 2 != 0) {
            throw new IllegalArgumentException("Hex string must have an even number of digits");
        }
        try {
            return Hex.decode(digits);
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Invalid hex string: " + e.getMessage(), e);
        }
    }

    public static String encode(byte[] bytes) {
        return "0x" + Hex.toHexString(bytes);
    }

}
