package com.silentrisk.vault.model.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import org.bouncycastle.util.encoders.Hex;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A 20-byte ledger account address, held in canonical lowercase hex form.
 */
@EqualsAndHashCode
public final class Address {

    private static final Pattern HEX_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    private final String value;

    private Address(String value) {
        this.value = value;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Address of(String hex) {
        if (hex == null || !HEX_ADDRESS.matcher(hex.trim()).matches()) {
            throw new IllegalArgumentException("Invalid address: " + hex);
        }
        return new Address(hex.trim().toLowerCase(Locale.ROOT));
    }

    public static Address fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != 20) {
            throw new IllegalArgumentException("Address must be 20 bytes");
        }
        return new Address("0x" + Hex.toHexString(bytes));
    }

    public byte[] toBytes() {
        return Hex.decode(value.substring(2));
    }

    public boolean isZero() {
        return ZERO.equals(this);
    }

    @JsonValue
    public String toHex() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }

}
