// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import sh.sift.primitives.Hex;

/**
 * Hex-encoded 32-byte hash (Keccak-256).
 * <p>
 * Used for block hashes, transaction hashes and log topics.
 *
 * @since 0.1.0
 */
public record Hash(@com.fasterxml.jackson.annotation.JsonValue String value) {
    public static final int BYTE_LENGTH = 32;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    public Hash {
        Objects.requireNonNull(value, "hash");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hash: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    /**
     * @return the 64 lowercase hex characters without the {@code 0x} prefix
     */
    public String keyHex() {
        return value.substring(2);
    }

    public static Hash fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Hash must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Hash("0x" + Hex.encodeNoPrefix(bytes));
    }
}
