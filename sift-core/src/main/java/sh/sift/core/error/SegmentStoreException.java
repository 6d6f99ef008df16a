// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.error;

/**
 * Thrown when the segment store fails to answer: timeouts, connectivity loss,
 * permission or disk errors.
 *
 * <p>
 * <strong>Design Note:</strong> This class is {@code non-sealed} so store backends can
 * add their own failure types. Whether a failure is worth retrying is carried by
 * {@link #isRetryable()}, not by the subtype.
 *
 * @since 0.1.0
 */
public non-sealed class SegmentStoreException extends SiftException {

    private final boolean retryable;

    public SegmentStoreException(final String message, final boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public SegmentStoreException(final String message, final boolean retryable, final Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    /**
     * @return {@code true} if the same operation may succeed when attempted again
     */
    public boolean isRetryable() {
        return retryable;
    }

    public boolean isTimeout() {
        final String msg = getMessage();
        return msg != null && msg.toLowerCase(java.util.Locale.ROOT).contains("timed out");
    }
}
