// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core;

import static sh.sift.core.AnsiColors.*;

/**
 * One-line formatters for segment and filter debug events.
 *
 * <p>All events use a bracketed {@code [OPERATION]} tag followed by
 * {@code key=value} fields. Status symbols (✓ ✗) mark outcomes.
 *
 * <pre>{@code
 * DebugLogger.logIndex(LogFormatter.formatSegmentFlush("0000000100.100.combined.idx", 42, 1500));
 * // ✓ [SEGMENT-FLUSH] segment=0000000100.100.combined.idx keys=42 duration=1.5ms
 *
 * DebugLogger.logFilter(LogFormatter.formatIndexSkip(100, 200, "combined"));
 * // [INDEX-SKIP] from=100 to=200 kind=combined
 * }</pre>
 *
 * @see DebugLogger
 */
public final class LogFormatter {

    private static final int HASH_PREFIX_LENGTH = 6;
    private static final int HASH_SUFFIX_LENGTH = 4;
    private static final int HASH_SHORTEN_THRESHOLD = HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH;

    private LogFormatter() {
    }

    /**
     * Format: ✓ [SEGMENT-FLUSH] segment=... keys=42 duration=1.5ms
     */
    public static String formatSegmentFlush(String segment, int keys, long durationMicros) {
        return String.format(
                "%s✓%s %s[SEGMENT-FLUSH]%s segment=%s keys=%d duration=%s",
                TEAL, RESET,
                INDIGO, RESET,
                segment, keys, duration(durationMicros));
    }

    /**
     * Format: ✗ [SEGMENT-FLUSH] segment=... error=...
     */
    public static String formatSegmentFlushError(String segment, String error) {
        return String.format(
                "%s✗%s %s[SEGMENT-FLUSH]%s segment=%s error=%s%s%s",
                CORAL, RESET,
                CORAL, RESET,
                segment,
                CORAL, error, RESET);
    }

    /**
     * Format: ✓ [SEGMENT-LOAD] segment=... keys=42 matches=3 duration=1.5ms
     */
    public static String formatSegmentLoad(String segment, int keys, long matches, long durationMicros) {
        return String.format(
                "%s✓%s %s[SEGMENT-LOAD]%s segment=%s keys=%d matches=%d duration=%s",
                TEAL, RESET,
                INDIGO, RESET,
                segment, keys, matches, duration(durationMicros));
    }

    /**
     * Format: [INDEX-SKIP] from=100 to=200 kind=combined
     */
    public static String formatIndexSkip(long fromBlock, long toBlockExclusive, String kind) {
        return String.format(
                "%s[INDEX-SKIP]%s from=%d to=%d kind=%s",
                SLATE, RESET,
                fromBlock, toBlockExclusive, kind);
    }

    /**
     * Format: [INDEX-FALLBACK] block=100 reason=...
     */
    public static String formatIndexFallback(long blockNum, String reason) {
        return String.format(
                "%s[INDEX-FALLBACK]%s block=%d reason=%s",
                AMBER, RESET,
                blockNum, reason);
    }

    /**
     * Format: [FILTER] block=100 hash=0xabcd...ef01 kept=2/10
     */
    public static String formatFilterResult(long blockNum, String blockHash, int kept, int total) {
        return String.format(
                "%s[FILTER]%s block=%d hash=%s kept=%d/%d",
                INDIGO, RESET,
                blockNum, shortenHash(blockHash), kept, total);
    }

    static String shortenHash(String fullHash) {
        if (fullHash == null || fullHash.length() <= HASH_SHORTEN_THRESHOLD) {
            return fullHash;
        }
        return fullHash.substring(0, HASH_PREFIX_LENGTH)
                + "..."
                + fullHash.substring(fullHash.length() - HASH_SUFFIX_LENGTH);
    }
}
