// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.index;

import java.util.Objects;
import java.util.Set;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.sift.core.DebugLogger;
import sh.sift.core.LogFormatter;
import sh.sift.core.error.SegmentStoreException;
import sh.sift.core.model.Block;
import sh.sift.index.store.SegmentId;
import sh.sift.index.store.SegmentStore;
import sh.sift.index.store.StoreRetry;

/**
 * Builds segments of one {@link IndexKind} from an ordered block stream and publishes
 * each one when the stream crosses its upper boundary.
 *
 * <p>
 * Blocks must arrive in non-decreasing number order. The first segment is snapped to the
 * aligned boundary below the first block, so starting at block 37 with size 100 opens
 * {@code [0, 100)}. A segment is written exactly once; blocks numbered below an already
 * published range are rejected.
 *
 * <p>
 * Each flush is bounded by {@link IndexConfig#flushTimeout()}. If a flush fails, the
 * segment stays in memory and the failing block is not ingested. The next
 * {@link #ingest(Block)} call, or {@link #close(boolean)}, re-attempts the same flush
 * first, so the indexer never moves past a segment it could not publish.
 *
 * <p>Not thread-safe.
 */
public final class SegmentIndexer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SegmentIndexer.class);

    private final SegmentStore store;
    private final KeyExtractor extractor;
    private final IndexConfig config;
    private final long indexSize;

    private @Nullable BitmapSegment current;
    private long publishedUpTo = -1;
    private boolean flushFailed;
    private boolean closed;

    public SegmentIndexer(final SegmentStore store, final IndexKind kind, final IndexConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        this.extractor = new KeyExtractor(kind);
        this.config = Objects.requireNonNull(config, "config");
        this.indexSize = config.indexSize();
    }

    public IndexKind kind() {
        return extractor.kind();
    }

    /**
     * Adds the keys of {@code block} to the open segment, flushing it first if the block
     * lies past its range.
     *
     * @throws IllegalArgumentException if the block lies in an already published range
     *                                  or before the open segment
     * @throws SegmentStoreException    if a pending flush fails again
     * @throws IllegalStateException    if the indexer is closed
     */
    public void ingest(final Block block) {
        Objects.requireNonNull(block, "block");
        if (closed) {
            throw new IllegalStateException("SegmentIndexer is closed");
        }
        final long number = block.number();
        final long floor = current != null ? current.low() : publishedUpTo;
        if (number < floor) {
            throw new IllegalArgumentException(
                    "Block " + number + " arrives out of order; indexing already reached block " + floor);
        }
        if (current != null && number >= current.highExclusive()) {
            flush(current);
            current = null;
        }
        if (current == null) {
            current = new BitmapSegment(SegmentId.lowBoundary(number, indexSize), indexSize);
            log.debug("Opened {} segment [{}, {})", kind().shortname(), current.low(), current.highExclusive());
        }
        final Set<String> keys = extractor.extract(block);
        for (String key : keys) {
            current.add(key, number);
        }
    }

    /**
     * @return identity of the open segment, or {@code null} if none is open
     */
    public @Nullable SegmentId currentSegment() {
        return current == null ? null : current.id(kind().shortname());
    }

    /**
     * Closes the indexer, discarding a partially filled segment.
     */
    @Override
    public void close() {
        close(false);
    }

    /**
     * Closes the indexer.
     *
     * <p>A segment whose range was fully traversed but whose flush failed is published
     * regardless of {@code flushPartial}.
     *
     * @param flushPartial whether to publish the open segment even though its range was
     *                     not fully traversed; readers will then treat the missing tail as
     *                     containing no matches
     * @throws SegmentStoreException if a required flush fails
     */
    public void close(final boolean flushPartial) {
        if (closed) {
            return;
        }
        closed = true;
        final BitmapSegment open = current;
        current = null;
        if (open == null) {
            return;
        }
        if (flushFailed) {
            try {
                flush(open);
            } catch (SegmentStoreException e) {
                log.warn("Discarding unpublished full {} segment [{}, {}) on close",
                        kind().shortname(), open.low(), open.highExclusive());
                throw e;
            }
        } else if (flushPartial) {
            flush(open);
        } else {
            log.debug("Discarding partial {} segment [{}, {})",
                    kind().shortname(), open.low(), open.highExclusive());
        }
    }

    private void flush(final BitmapSegment segment) {
        final SegmentId id = segment.id(kind().shortname());
        final long start = System.nanoTime();
        final byte[] payload = segment.serialize();
        final boolean retrying = flushFailed;
        try {
            StoreDeadline.call("Publishing segment " + id, () -> StoreRetry.run("write " + id, () -> {
                // a timed-out attempt may still have landed
                if (!(retrying && store.exists(id))) {
                    store.write(id, payload);
                }
                return id;
            }, config.maxStoreAttempts(), config.retry()), config.flushTimeout());
        } catch (SegmentStoreException e) {
            flushFailed = true;
            log.warn("Failed to publish segment {}; it will be retried before indexing continues", id, e);
            DebugLogger.logIndex(LogFormatter.formatSegmentFlushError(id.fileName(), e.getMessage()));
            throw e;
        }
        flushFailed = false;
        publishedUpTo = segment.highExclusive();
        final long micros = (System.nanoTime() - start) / 1_000;
        DebugLogger.logIndex(LogFormatter.formatSegmentFlush(id.fileName(), segment.keyCount(), micros));
    }
}
