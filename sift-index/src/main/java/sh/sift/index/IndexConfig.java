// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.index;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

import sh.sift.index.store.StoreRetryConfig;

/**
 * Settings shared by segment writers and readers.
 *
 * <pre>{@code
 * IndexConfig config = IndexConfig.builder()
 *     .indexSize(1000)
 *     .possibleIndexSizes(List.of(1000, 10000))
 *     .loadTimeout(Duration.ofSeconds(5))
 *     .flushTimeout(Duration.ofSeconds(20))
 *     .build();
 * }</pre>
 *
 * @param indexSize          segment size used when writing
 * @param possibleIndexSizes segment sizes probed, in order, when reading
 * @param loadTimeout        upper bound on a single existence probe or segment load
 * @param flushTimeout       upper bound on publishing one segment, retries included
 * @param retry              backoff for store operations
 * @param maxStoreAttempts   attempts per store operation, &gt;= 1
 */
public record IndexConfig(
        long indexSize,
        List<Long> possibleIndexSizes,
        Duration loadTimeout,
        Duration flushTimeout,
        StoreRetryConfig retry,
        int maxStoreAttempts) {

    public static final long DEFAULT_INDEX_SIZE = 10_000;
    public static final List<Long> DEFAULT_POSSIBLE_INDEX_SIZES = List.of(10_000L, 1_000L, 100_000L);
    public static final Duration DEFAULT_LOAD_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_FLUSH_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_STORE_ATTEMPTS = 3;

    public IndexConfig {
        Objects.requireNonNull(possibleIndexSizes, "possibleIndexSizes");
        Objects.requireNonNull(loadTimeout, "loadTimeout");
        Objects.requireNonNull(flushTimeout, "flushTimeout");
        Objects.requireNonNull(retry, "retry");
        if (indexSize <= 0) {
            throw new IllegalArgumentException("indexSize must be > 0, got: " + indexSize);
        }
        possibleIndexSizes = List.copyOf(possibleIndexSizes);
        if (possibleIndexSizes.isEmpty()) {
            throw new IllegalArgumentException("possibleIndexSizes must not be empty");
        }
        for (Long size : possibleIndexSizes) {
            if (size <= 0) {
                throw new IllegalArgumentException("possibleIndexSizes must be > 0, got: " + size);
            }
        }
        if (loadTimeout.isNegative() || loadTimeout.isZero()) {
            throw new IllegalArgumentException("loadTimeout must be positive, got: " + loadTimeout);
        }
        if (flushTimeout.isNegative() || flushTimeout.isZero()) {
            throw new IllegalArgumentException("flushTimeout must be positive, got: " + flushTimeout);
        }
        if (maxStoreAttempts < 1) {
            throw new IllegalArgumentException("maxStoreAttempts must be >= 1, got: " + maxStoreAttempts);
        }
    }

    public static IndexConfig defaults() {
        return builder().build();
    }

    /**
     * @return the smallest probed segment size
     */
    public long smallestIndexSize() {
        long smallest = Long.MAX_VALUE;
        for (Long size : possibleIndexSizes) {
            smallest = Math.min(smallest, size);
        }
        return smallest;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long indexSize = DEFAULT_INDEX_SIZE;
        private List<Long> possibleIndexSizes = DEFAULT_POSSIBLE_INDEX_SIZES;
        private Duration loadTimeout = DEFAULT_LOAD_TIMEOUT;
        private Duration flushTimeout = DEFAULT_FLUSH_TIMEOUT;
        private StoreRetryConfig retry = StoreRetryConfig.defaults();
        private int maxStoreAttempts = DEFAULT_MAX_STORE_ATTEMPTS;

        private Builder() {}

        public Builder indexSize(long indexSize) {
            this.indexSize = indexSize;
            return this;
        }

        public Builder possibleIndexSizes(List<Long> possibleIndexSizes) {
            this.possibleIndexSizes = possibleIndexSizes;
            return this;
        }

        public Builder loadTimeout(Duration loadTimeout) {
            this.loadTimeout = loadTimeout;
            return this;
        }

        public Builder flushTimeout(Duration flushTimeout) {
            this.flushTimeout = flushTimeout;
            return this;
        }

        public Builder retry(StoreRetryConfig retry) {
            this.retry = retry;
            return this;
        }

        public Builder maxStoreAttempts(int maxStoreAttempts) {
            this.maxStoreAttempts = maxStoreAttempts;
            return this;
        }

        public IndexConfig build() {
            return new IndexConfig(indexSize, possibleIndexSizes, loadTimeout, flushTimeout, retry, maxStoreAttempts);
        }
    }
}
