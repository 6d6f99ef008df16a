// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core;

/**
 * ANSI colour codes for debug output, disabled automatically off a TTY unless
 * {@code FORCE_COLOR=true} is set.
 *
 * <ul>
 * <li><b>TEAL</b> - success</li>
 * <li><b>CORAL</b> - errors</li>
 * <li><b>INDIGO</b> - segment I/O</li>
 * <li><b>AMBER</b> - fallbacks</li>
 * <li><b>SLATE</b> - skipped ranges</li>
 * </ul>
 *
 * @see LogFormatter
 */
public final class AnsiColors {

    static final boolean IS_TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    /** ANSI reset code - clears all formatting */
    public static final String RESET = ansi("0");

    public static final String TEAL = ansi("38;5;44");

    public static final String CORAL = ansi("38;5;204");

    public static final String INDIGO = ansi("38;5;99");

    public static final String AMBER = ansi("38;5;214");

    public static final String SLATE = ansi("38;5;247");

    private AnsiColors() {
    }

    private static String ansi(final String code) {
        return IS_TTY ? "\u001B[" + code + "m" : "";
    }

    /**
     * Formats a duration in microseconds as a human-readable string.
     *
     * @param micros duration in microseconds
     * @return formatted duration (e.g., "1.5ms" or "2.30s")
     */
    public static String duration(final long micros) {
        if (micros < 1000)
            return micros + "us";
        if (micros < 1_000_000)
            return String.format(java.util.Locale.ROOT, "%.1fms", micros / 1000.0);
        return String.format(java.util.Locale.ROOT, "%.2fs", micros / 1_000_000.0);
    }
}
