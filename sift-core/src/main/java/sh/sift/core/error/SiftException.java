// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.error;

/**
 * Base runtime exception for all sift failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * SiftException
 * ├── {@link FilterConfigurationException} - malformed filter or index configuration
 * ├── {@link IndexFormatException} - corrupt or truncated segment payload
 * ├── {@link IndexUnavailableException} - no segment covers a block at any candidate size
 * ├── {@link RangeViolationException} - block number outside a segment's bounds
 * └── {@link SegmentStoreException} - segment store I/O failure
 *     └── {@link RetryExhaustedException} - retries of a transient failure ran out
 * </pre>
 *
 * <p>
 * On the query path, {@link IndexFormatException}, {@link IndexUnavailableException}
 * and {@link SegmentStoreException} mean "skip the index and filter exactly". On the
 * indexing path every one of them aborts ingestion.
 *
 * <pre>{@code
 * try {
 *     provider.loadIfNeeded(blockNum);
 * } catch (IndexUnavailableException e) {
 *     // no index for this range, decode and filter every block
 * } catch (SegmentStoreException e) {
 *     if (e.isRetryable()) {
 *         // back off and try again, or decode without the index
 *     }
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class SiftException extends RuntimeException
        permits FilterConfigurationException,
        IndexFormatException,
        IndexUnavailableException,
        RangeViolationException,
        SegmentStoreException {

    public SiftException(final String message) {
        super(message);
    }

    public SiftException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
