// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core;

/**
 * Global toggle for verbose tracing of index and filter activity.
 *
 * <p>Thread safety: the flags are volatile.
 */
public final class SiftDebug {

    private static volatile boolean indexLogging = false;
    private static volatile boolean filterLogging = false;

    private SiftDebug() {
    }

    public static void setIndexLogging(final boolean enabled) {
        indexLogging = enabled;
    }

    public static boolean isIndexLoggingEnabled() {
        return indexLogging;
    }

    public static void setFilterLogging(final boolean enabled) {
        filterLogging = enabled;
    }

    public static boolean isFilterLoggingEnabled() {
        return filterLogging;
    }
}
