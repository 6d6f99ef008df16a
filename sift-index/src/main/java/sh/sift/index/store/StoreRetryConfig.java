// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.index.store;

/**
 * Backoff timing for retried segment store operations.
 *
 * <p>
 * <strong>Backoff Formula:</strong>
 * <pre>
 *   delay = min(base * 2^(attempt-1), max)
 *   finalDelay = delay + delay * random(jitterMin, jitterMax)
 * </pre>
 *
 * <pre>{@code
 * StoreRetryConfig fast = StoreRetryConfig.builder()
 *     .backoffBaseMs(10)
 *     .backoffMaxMs(100)
 *     .build();
 * }</pre>
 *
 * @param backoffBaseMs base delay in milliseconds (must be &gt; 0)
 * @param backoffMaxMs  maximum delay cap in milliseconds (must be &gt;= backoffBaseMs)
 * @param jitterMin     minimum jitter fraction (must be &gt;= 0 and &lt; jitterMax)
 * @param jitterMax     maximum jitter fraction (must be &gt; jitterMin)
 * @see StoreRetry
 */
public record StoreRetryConfig(
        long backoffBaseMs,
        long backoffMaxMs,
        double jitterMin,
        double jitterMax) {

    /** Default base delay: 200ms. */
    public static final long DEFAULT_BACKOFF_BASE_MS = 200;

    /** Default maximum delay: 5000ms. */
    public static final long DEFAULT_BACKOFF_MAX_MS = 5000;

    /** Default minimum jitter: 10%. */
    public static final double DEFAULT_JITTER_MIN = 0.10;

    /** Default maximum jitter: 25%. */
    public static final double DEFAULT_JITTER_MAX = 0.25;

    public StoreRetryConfig {
        if (backoffBaseMs <= 0) {
            throw new IllegalArgumentException("backoffBaseMs must be > 0, got: " + backoffBaseMs);
        }
        if (backoffMaxMs < backoffBaseMs) {
            throw new IllegalArgumentException(
                    "backoffMaxMs must be >= backoffBaseMs, got: " + backoffMaxMs + " < " + backoffBaseMs);
        }
        if (jitterMin < 0) {
            throw new IllegalArgumentException("jitterMin must be >= 0, got: " + jitterMin);
        }
        if (jitterMax <= jitterMin) {
            throw new IllegalArgumentException(
                    "jitterMax must be > jitterMin, got: " + jitterMax + " <= " + jitterMin);
        }
    }

    /**
     * @return default config with 200ms base, 5000ms max, 10-25% jitter
     */
    public static StoreRetryConfig defaults() {
        return new StoreRetryConfig(
                DEFAULT_BACKOFF_BASE_MS,
                DEFAULT_BACKOFF_MAX_MS,
                DEFAULT_JITTER_MIN,
                DEFAULT_JITTER_MAX);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link StoreRetryConfig}; starts from the defaults.
     */
    public static final class Builder {
        private long backoffBaseMs = DEFAULT_BACKOFF_BASE_MS;
        private long backoffMaxMs = DEFAULT_BACKOFF_MAX_MS;
        private double jitterMin = DEFAULT_JITTER_MIN;
        private double jitterMax = DEFAULT_JITTER_MAX;

        private Builder() {}

        public Builder backoffBaseMs(long backoffBaseMs) {
            this.backoffBaseMs = backoffBaseMs;
            return this;
        }

        public Builder backoffMaxMs(long backoffMaxMs) {
            this.backoffMaxMs = backoffMaxMs;
            return this;
        }

        public Builder jitterMin(double jitterMin) {
            this.jitterMin = jitterMin;
            return this;
        }

        public Builder jitterMax(double jitterMax) {
            this.jitterMax = jitterMax;
            return this;
        }

        public StoreRetryConfig build() {
            return new StoreRetryConfig(backoffBaseMs, backoffMaxMs, jitterMin, jitterMax);
        }
    }
}
