// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.index.store;

import sh.sift.core.error.SegmentStoreException;

/**
 * Named-object storage for published segments.
 *
 * <p>Segments are write-once: a second {@link #write} of the same identity is rejected
 * with a non-retryable {@link SegmentStoreException}. Readers must never observe a
 * partially written object.
 *
 * <p>Implementations must be safe for concurrent use by one writer and many readers.
 */
public interface SegmentStore {

    /**
     * @param id segment identity
     * @return whether the segment has been published
     * @throws SegmentStoreException on storage failure
     */
    boolean exists(SegmentId id);

    /**
     * Publishes a segment.
     *
     * @param id      segment identity
     * @param payload serialized segment
     * @throws SegmentStoreException on storage failure, or if {@code id} already exists
     */
    void write(SegmentId id, byte[] payload);

    /**
     * Reads a published segment.
     *
     * @param id segment identity
     * @return the serialized segment
     * @throws SegmentStoreException on storage failure, or if {@code id} does not exist
     */
    byte[] open(SegmentId id);
}
