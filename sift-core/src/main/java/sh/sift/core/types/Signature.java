// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Hex-encoded event or method signature, as supplied in filter clauses.
 * <p>
 * Event signatures are the 32-byte {@code topics[0]} of a log; method signatures are
 * the 4-byte selector at the start of call input. No other width is accepted.
 *
 * @since 0.1.0
 */
public record Signature(@com.fasterxml.jackson.annotation.JsonValue String value) {
    public static final int SELECTOR_LENGTH = 4;
    private static final Pattern SELECTOR_HEX = HexValidator.fixedLength(SELECTOR_LENGTH);
    private static final Pattern TOPIC_HEX = HexValidator.fixedLength(Hash.BYTE_LENGTH);

    public Signature {
        Objects.requireNonNull(value, "signature");
        if (!SELECTOR_HEX.matcher(value).matches() && !TOPIC_HEX.matcher(value).matches()) {
            throw new IllegalArgumentException(
                    "Invalid signature, expected " + SELECTOR_LENGTH + " or " + Hash.BYTE_LENGTH + " bytes: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    /**
     * @return the lowercase hex characters without the {@code 0x} prefix, the form used
     *         as an index key
     */
    public String keyHex() {
        return value.substring(2);
    }

    public int byteLength() {
        return (value.length() - 2) / 2;
    }

    public boolean isSelector() {
        return byteLength() == SELECTOR_LENGTH;
    }

    public static Signature of(final Hash topic) {
        Objects.requireNonNull(topic, "topic");
        return new Signature(topic.value());
    }
}
