// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.error;

/**
 * Thrown when a block number outside {@code [low, low+size)} is added to a segment.
 *
 * <p>This indicates a bug in the caller; indexing must stop rather than write a
 * segment whose contents disagree with its identity.
 *
 * @since 0.1.0
 */
public final class RangeViolationException extends SiftException {

    private final long blockNum;
    private final long low;
    private final long size;

    public RangeViolationException(final String key, final long blockNum, final long low, final long size) {
        super("Block " + blockNum + " for key " + key + " is outside segment range ["
                + low + ", " + (low + size) + ")");
        this.blockNum = blockNum;
        this.low = low;
        this.size = size;
    }

    public long blockNum() {
        return blockNum;
    }

    public long low() {
        return low;
    }

    public long size() {
        return size;
    }
}
