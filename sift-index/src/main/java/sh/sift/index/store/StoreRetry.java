// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.index.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.sift.core.error.RetryExhaustedException;
import sh.sift.core.error.SegmentStoreException;

/**
 * Retries segment store operations with exponential backoff.
 *
 * <p>
 * Only {@link SegmentStoreException}s flagged {@linkplain SegmentStoreException#isRetryable()
 * retryable} are retried. Anything else, including a rejected duplicate write, is thrown
 * on first occurrence.
 *
 * <p>
 * <strong>Backoff Strategy:</strong>
 * <ul>
 * <li>Attempt 1: No delay</li>
 * <li>Attempt 2: 200ms + 10-25% jitter</li>
 * <li>Attempt 3: 400ms + 10-25% jitter</li>
 * <li>Attempt 4+: doubled each time, capped at 5000ms + jitter</li>
 * </ul>
 *
 * <p>
 * <strong>Thread Interruption:</strong> If the calling thread is interrupted during
 * backoff, the loop stops and the last failure is thrown with the interruption
 * attached as suppressed.
 */
public final class StoreRetry {

    private static final Logger log = LoggerFactory.getLogger(StoreRetry.class);

    private StoreRetry() {
    }

    /**
     * Runs {@code operation} until it succeeds, fails permanently, or runs out of attempts.
     *
     * @param <T>         the return type
     * @param operation   short description used in messages, e.g. {@code "write 0000000000.100.combined.idx"}
     * @param supplier    the store call
     * @param maxAttempts maximum number of attempts (must be &gt;= 1)
     * @param config      backoff timing
     * @return the supplier's result
     * @throws SegmentStoreException   if a non-retryable store failure occurs
     * @throws RetryExhaustedException if every attempt failed with a retryable failure;
     *                                 earlier failures are attached as suppressed
     * @throws IllegalArgumentException if maxAttempts &lt; 1
     */
    public static <T> T run(
            final String operation,
            final Supplier<T> supplier,
            final int maxAttempts,
            final StoreRetryConfig config) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(supplier, "supplier");
        Objects.requireNonNull(config, "config");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }

        List<SegmentStoreException> failedAttempts = null;
        final long startTime = System.currentTimeMillis();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return supplier.get();
            } catch (SegmentStoreException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                if (failedAttempts == null) {
                    failedAttempts = new ArrayList<>();
                }
                failedAttempts.add(e);
                if (attempt == maxAttempts) {
                    throw exhausted(operation, failedAttempts, startTime);
                }
                log.debug("{} failed on attempt {}/{}: {}", operation, attempt, maxAttempts, e.getMessage());
            }

            final long delayMillis = backoff(attempt, config);
            try {
                Thread.sleep(delayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                final SegmentStoreException last = failedAttempts.get(failedAttempts.size() - 1);
                last.addSuppressed(e);
                throw last;
            }
        }
        throw new IllegalStateException("Retry finished without result or exception");
    }

    static long backoff(final int attempt, final StoreRetryConfig config) {
        final long delay = config.backoffBaseMs() * (1L << Math.min(attempt - 1, 30));
        final long cappedDelay = Math.min(delay, config.backoffMaxMs());
        final double jitter = ThreadLocalRandom.current().nextDouble(config.jitterMin(), config.jitterMax());
        return cappedDelay + (long) (cappedDelay * jitter);
    }

    private static RetryExhaustedException exhausted(
            final String operation,
            final List<SegmentStoreException> failedAttempts,
            final long startTime) {
        final long totalDuration = System.currentTimeMillis() - startTime;
        final Throwable lastFailure = failedAttempts.get(failedAttempts.size() - 1);
        final RetryExhaustedException exhausted =
                new RetryExhaustedException(operation, failedAttempts.size(), totalDuration, lastFailure);
        for (int i = 0; i < failedAttempts.size() - 1; i++) {
            exhausted.addSuppressed(failedAttempts.get(i));
        }
        return exhausted;
    }
}
