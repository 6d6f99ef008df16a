// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.index.store;

import java.util.Objects;

/**
 * Identity of a published segment: its aligned range and the index kind it belongs to.
 *
 * <p>The file name is {@code <low zero-padded to 10 digits>.<size>.<kind>.idx}, so a
 * directory listing sorts segments by block number.
 *
 * @param low  first block number covered, a multiple of {@code size}
 * @param size number of block numbers covered
 * @param kind index kind shortname, e.g. {@code combined}
 */
public record SegmentId(long low, long size, String kind) {

    public SegmentId {
        Objects.requireNonNull(kind, "kind");
        if (size <= 0) {
            throw new IllegalArgumentException("size must be > 0, got: " + size);
        }
        if (low < 0 || low % size != 0) {
            throw new IllegalArgumentException("low must be a non-negative multiple of " + size + ", got: " + low);
        }
    }

    /**
     * @param blockNum any block number
     * @param size     segment size
     * @param kind     index kind shortname
     * @return the segment of {@code size} whose range contains {@code blockNum}
     */
    public static SegmentId covering(final long blockNum, final long size, final String kind) {
        return new SegmentId(lowBoundary(blockNum, size), size, kind);
    }

    /**
     * @return {@code blockNum - blockNum % size}
     */
    public static long lowBoundary(final long blockNum, final long size) {
        if (blockNum < 0) {
            throw new IllegalArgumentException("blockNum must be >= 0, got: " + blockNum);
        }
        return blockNum - blockNum % size;
    }

    public long highExclusive() {
        return low + size;
    }

    public boolean covers(final long blockNum) {
        return blockNum >= low && blockNum < low + size;
    }

    public String fileName() {
        return String.format("%010d.%d.%s.idx", low, size, kind);
    }

    @Override
    public String toString() {
        return fileName();
    }
}
