// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.types;

import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;

import sh.sift.primitives.Hex;

/**
 * Variable-length byte payload: call input, return data, log data.
 *
 * <p>The bytes are held raw and the {@code 0x} string form is computed lazily,
 * since most payloads flowing through a filter are never rendered.
 *
 * @since 0.1.0
 */
public final class HexData {
    private static final Pattern HEX = Pattern.compile("^0x([0-9a-fA-F]{2})*$");
    public static final HexData EMPTY = new HexData(new byte[0]);

    private final byte[] raw;
    private String value;

    private HexData(byte[] raw) {
        this.raw = raw;
    }

    public static HexData of(final String value) {
        Objects.requireNonNull(value, "hex");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hex data: " + value);
        }
        return fromBytes(Hex.decode(value));
    }

    public static HexData fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return EMPTY;
        }
        return new HexData(bytes.clone());
    }

    @com.fasterxml.jackson.annotation.JsonValue
    public String value() {
        if (value == null) {
            value = Hex.encode(raw);
        }
        return value;
    }

    public int byteLength() {
        return raw.length;
    }

    public boolean isEmpty() {
        return raw.length == 0;
    }

    public byte[] toBytes() {
        return raw.clone();
    }

    /**
     * Returns the first {@code byteCount} bytes as bare lowercase hex.
     *
     * @param byteCount number of leading bytes
     * @return the hex, or {@code null} if the payload is shorter than {@code byteCount}
     */
    public String leadingKeyHex(final int byteCount) {
        if (raw.length < byteCount) {
            return null;
        }
        return Hex.encodeNoPrefix(raw, 0, byteCount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return Arrays.equals(raw, ((HexData) o).raw);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(raw);
    }

    @Override
    public String toString() {
        return "HexData[" + "value=" + value() + ']';
    }
}
