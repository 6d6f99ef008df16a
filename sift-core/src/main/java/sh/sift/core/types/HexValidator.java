// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.types;

import java.util.regex.Pattern;

/**
 * Compiled patterns for validating {@code 0x}-prefixed hex strings.
 * Used by {@link Address}, {@link Hash}, {@link Signature} and {@link HexData}.
 *
 * @since 0.1.0
 */
public final class HexValidator {
    private HexValidator() {}

    /**
     * Creates a compiled pattern that matches hex strings of exactly the specified byte length.
     *
     * @param byteLength the exact number of bytes the hex string must represent
     * @return a compiled pattern requiring "0x" and {@code byteLength * 2} hex characters
     */
    public static Pattern fixedLength(int byteLength) {
        int hexChars = byteLength * 2;
        return Pattern.compile("^0x[0-9a-fA-F]{" + hexChars + "}$");
    }
}
