// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.types;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Non-negative amount of wei carried by calls, transactions and balance changes.
 *
 * @since 0.1.0
 */
public record Wei(BigInteger value) {

    public static final Wei ZERO = new Wei(BigInteger.ZERO);

    public Wei {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Wei must be non-negative");
        }
    }

    public static Wei of(final long wei) {
        return new Wei(BigInteger.valueOf(wei));
    }

    public static Wei of(final BigInteger wei) {
        return new Wei(wei);
    }

    @com.fasterxml.jackson.annotation.JsonValue
    public String toHexString() {
        return "0x" + value.toString(16);
    }
}
