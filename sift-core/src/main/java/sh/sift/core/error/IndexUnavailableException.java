// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.error;

import java.util.List;

/**
 * Signals that no segment covering a block exists at any candidate size.
 *
 * <p>This is not a failure of the stream: callers fall back to exact decode-time
 * filtering for the affected range. It is never raised for transient I/O problems,
 * which surface as {@link SegmentStoreException}.
 *
 * @since 0.1.0
 */
public final class IndexUnavailableException extends SiftException {

    private final long blockNum;
    private final String kind;
    private final List<Long> probedSizes;

    public IndexUnavailableException(final long blockNum, final String kind, final List<Long> probedSizes) {
        super("No " + kind + " index segment covers block " + blockNum + " (sizes probed: " + probedSizes + ")");
        this.blockNum = blockNum;
        this.kind = kind;
        this.probedSizes = List.copyOf(probedSizes);
    }

    public long blockNum() {
        return blockNum;
    }

    public String kind() {
        return kind;
    }

    public List<Long> probedSizes() {
        return probedSizes;
    }
}
