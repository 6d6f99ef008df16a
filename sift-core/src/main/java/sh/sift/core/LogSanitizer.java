// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core;

/**
 * Bounds the size of debug log payloads.
 *
 * <p>Filter descriptions and key lists can grow with the size of a consumer request,
 * so anything past {@value #MAX_LOG_LENGTH} characters is cut and suffixed.
 */
public final class LogSanitizer {

    /** Maximum length for sanitized log output. */
    static final int MAX_LOG_LENGTH = 2000;

    /** Suffix appended to truncated logs. */
    static final String TRUNCATION_SUFFIX = "...(truncated)";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }
        if (input.length() <= MAX_LOG_LENGTH) {
            return input;
        }
        final int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
        return input.substring(0, truncateAt) + TRUNCATION_SUFFIX;
    }
}
