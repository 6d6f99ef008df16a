// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.filter;

/**
 * Counters of one {@link FilteredBlockStream#stream} run.
 *
 * @param emitted   blocks handed to the sink
 * @param decoded   blocks run through the exact transform
 * @param skipped   block numbers passed over on the index's word
 * @param fallbacks index failures that forced exact decoding
 */
public record StreamStats(long emitted, long decoded, long skipped, long fallbacks) {
}
