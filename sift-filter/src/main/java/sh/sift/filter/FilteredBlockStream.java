// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.filter;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.sift.core.DebugLogger;
import sh.sift.core.LogFormatter;
import sh.sift.core.error.IndexFormatException;
import sh.sift.core.error.IndexUnavailableException;
import sh.sift.core.error.SegmentStoreException;
import sh.sift.core.model.Block;
import sh.sift.index.NextMatch;
import sh.sift.index.SegmentIndexProvider;
import sh.sift.index.store.SegmentId;

/**
 * Delivers the filtered blocks of a range, using the index to skip blocks that cannot
 * match.
 *
 * <p>
 * Where a segment covers the current block, the stream jumps to the next candidate the
 * index reports and decodes only candidates. Where no segment exists, or loading one
 * fails, every block is decoded and filtered exactly until the next boundary of the
 * smallest configured segment size, where the index is consulted again. Index problems
 * therefore cost throughput, never results.
 *
 * <p>Blocks reach the sink in increasing block-number order. One stream serves one
 * session and is not thread-safe.
 */
public final class FilteredBlockStream {

    private static final Logger log = LoggerFactory.getLogger(FilteredBlockStream.class);

    private final BlockSource source;
    private final BlockTransform transform;
    private final @Nullable SegmentIndexProvider provider;
    private final boolean alwaysEmitHeader;

    /**
     * Streams through {@code filter}, using its index provider when it has one.
     */
    public FilteredBlockStream(final BlockSource source, final CombinedFilter filter) {
        this(source, filter, filter.compileIndexProvider(), filter.alwaysEmitHeader());
    }

    /**
     * @param source           block source
     * @param transform        exact transform applied to every decoded block
     * @param provider         index provider, or {@code null} to decode every block
     * @param alwaysEmitHeader whether skipped blocks are delivered as header-only blocks
     */
    public FilteredBlockStream(
            final BlockSource source,
            final BlockTransform transform,
            final @Nullable SegmentIndexProvider provider,
            final boolean alwaysEmitHeader) {
        this.source = Objects.requireNonNull(source, "source");
        this.transform = Objects.requireNonNull(transform, "transform");
        this.provider = provider;
        this.alwaysEmitHeader = alwaysEmitHeader;
    }

    /**
     * Streams {@code [start, stopExclusive)} into {@code sink}.
     *
     * @return what the run did
     */
    public StreamStats stream(final long start, final long stopExclusive, final Consumer<Block> sink) {
        Objects.requireNonNull(sink, "sink");
        if (start < 0 || stopExclusive < start) {
            throw new IllegalArgumentException("Invalid range [" + start + ", " + stopExclusive + ")");
        }
        final Counters counters = new Counters();
        long n = start;
        long indexResumesAt = start;
        while (n < stopExclusive) {
            if (provider != null && n >= indexResumesAt) {
                try {
                    if (provider.withinRange(n)) {
                        final NextMatch next = provider.nextMatching(n, stopExclusive);
                        if (next.blockNum() > n) {
                            skip(n, next.blockNum(), sink, counters);
                            n = next.blockNum();
                            continue;
                        }
                    } else {
                        indexResumesAt = nextProbe(n);
                        DebugLogger.logFilter(LogFormatter.formatIndexFallback(n, "no segment"));
                    }
                } catch (IndexUnavailableException | IndexFormatException | SegmentStoreException e) {
                    indexResumesAt = nextProbe(n);
                    counters.fallbacks++;
                    log.warn("Index lookup failed at block {}, decoding exactly until block {}: {}",
                            n, indexResumesAt, e.getMessage());
                    DebugLogger.logFilter(LogFormatter.formatIndexFallback(n, e.getMessage()));
                }
            }
            decode(n, sink, counters);
            n++;
        }
        return new StreamStats(counters.emitted, counters.decoded, counters.skipped, counters.fallbacks);
    }

    private void decode(final long blockNum, final Consumer<Block> sink, final Counters counters) {
        final Block block = source.fetch(blockNum);
        if (block == null) {
            return;
        }
        counters.decoded++;
        final Optional<Block> out = transform.apply(block);
        if (out.isPresent()) {
            sink.accept(out.get());
            counters.emitted++;
        }
    }

    private void skip(final long from, final long toExclusive, final Consumer<Block> sink, final Counters counters) {
        DebugLogger.logFilter(LogFormatter.formatIndexSkip(from, toExclusive, provider.kind()));
        counters.skipped += toExclusive - from;
        if (!alwaysEmitHeader) {
            return;
        }
        for (long k = from; k < toExclusive; k++) {
            final Block block = source.fetch(k);
            if (block != null) {
                sink.accept(BlockProjections.headerOnly(block));
                counters.emitted++;
            }
        }
    }

    private long nextProbe(final long blockNum) {
        final long step = provider.config().smallestIndexSize();
        return SegmentId.lowBoundary(blockNum, step) + step;
    }

    private static final class Counters {
        long emitted;
        long decoded;
        long skipped;
        long fallbacks;
    }
}
