// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.error;

/**
 * Thrown when every attempt of a retryable store operation failed.
 *
 * <p>Earlier failures are attached as suppressed exceptions, in order; the last one
 * is the cause.
 *
 * @since 0.1.0
 */
public final class RetryExhaustedException extends SegmentStoreException {

    private final int attemptCount;
    private final long totalRetryDurationMs;

    public RetryExhaustedException(
            final String operation,
            final int attemptCount,
            final long totalRetryDurationMs,
            final Throwable lastFailure) {
        super(operation + " failed after " + attemptCount + " attempts over " + totalRetryDurationMs + "ms: "
                + (lastFailure == null ? "unknown" : lastFailure.getMessage()), false, lastFailure);
        this.attemptCount = attemptCount;
        this.totalRetryDurationMs = totalRetryDurationMs;
    }

    public int attemptCount() {
        return attemptCount;
    }

    public long totalRetryDurationMs() {
        return totalRetryDurationMs;
    }
}
