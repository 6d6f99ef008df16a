// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for segment and filter tracing.
 *
 * <p>Everything goes through the {@code sh.sift.debug} SLF4J logger at INFO so
 * the tracing can be routed independently of operational warnings.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.sift.debug");

    private DebugLogger() {
    }

    public static void logIndex(final String message, final Object... args) {
        if (!SiftDebug.isIndexLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logFilter(final String message, final Object... args) {
        if (!SiftDebug.isFilterLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
