// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.index;

/**
 * Answer of {@link SegmentIndexProvider#nextMatching(long, long)}.
 *
 * @param blockNum       the next candidate block, or the first block the loaded segment
 *                       can no longer speak for when {@code exhaustedRange} is set
 * @param exhaustedRange whether no candidate exists up to {@code blockNum}
 */
public record NextMatch(long blockNum, boolean exhaustedRange) {
}
