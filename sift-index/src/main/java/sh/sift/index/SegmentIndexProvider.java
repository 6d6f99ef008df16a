// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.index;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.jspecify.annotations.Nullable;
import org.roaringbitmap.longlong.Roaring64Bitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.sift.core.DebugLogger;
import sh.sift.core.LogFormatter;
import sh.sift.core.error.IndexFormatException;
import sh.sift.core.error.IndexUnavailableException;
import sh.sift.core.error.SegmentStoreException;
import sh.sift.index.store.SegmentId;
import sh.sift.index.store.SegmentStore;
import sh.sift.index.store.StoreRetry;

/**
 * Answers "may block N match?" from published segments, on behalf of one filter.
 *
 * <p>
 * For a block number the provider probes each configured segment size in order and uses
 * the first segment that exists. The loaded segment is evaluated once with the filter's
 * {@link BitmapMatcher} and cached together with its match set until a block outside its
 * range is asked about.
 *
 * <p>
 * Existence probes and segment reads run on a worker thread and are abandoned after the
 * configured load timeout. A segment that fails to decode is remembered and not fetched
 * again by this provider. All query methods are synchronized, so a provider may be
 * shared, but it is meant to serve one streaming session.
 *
 * <pre>{@code
 * SegmentIndexProvider provider = new SegmentIndexProvider(store, IndexKind.COMBINED, matcher, config);
 * if (provider.withinRange(blockNum) && !provider.matches(blockNum)) {
 *     // skip decoding blockNum
 * }
 * }</pre>
 */
public final class SegmentIndexProvider {

    private static final Logger log = LoggerFactory.getLogger(SegmentIndexProvider.class);

    private final SegmentStore store;
    private final String kind;
    private final List<Long> possibleIndexSizes;
    private final BitmapMatcher matcher;
    private final IndexConfig config;

    private final Set<SegmentId> undecodable = new HashSet<>();

    private @Nullable BitmapSegment segment;
    private @Nullable Roaring64Bitmap matches;

    public SegmentIndexProvider(
            final SegmentStore store,
            final IndexKind kind,
            final BitmapMatcher matcher,
            final IndexConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        this.kind = Objects.requireNonNull(kind, "kind").shortname();
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.config = Objects.requireNonNull(config, "config");
        this.possibleIndexSizes = config.possibleIndexSizes();
    }

    public String kind() {
        return kind;
    }

    public IndexConfig config() {
        return config;
    }

    /**
     * @param blockNum a block number
     * @return whether some published segment covers {@code blockNum}
     * @throws SegmentStoreException if the store cannot be queried
     */
    public synchronized boolean withinRange(final long blockNum) {
        if (segment != null && segment.covers(blockNum)) {
            return true;
        }
        return locate(blockNum) != null;
    }

    /**
     * Ensures the segment covering {@code blockNum} is loaded and evaluated.
     *
     * @throws IndexUnavailableException if no segment covers {@code blockNum}
     * @throws IndexFormatException      if the covering segment cannot be decoded
     * @throws SegmentStoreException     if the read fails or exceeds the load timeout
     */
    public synchronized void loadIfNeeded(final long blockNum) {
        if (segment != null && segment.covers(blockNum)) {
            return;
        }
        final SegmentId id = locate(blockNum);
        if (id == null) {
            throw new IndexUnavailableException(blockNum, kind, possibleIndexSizes);
        }
        if (undecodable.contains(id)) {
            throw new IndexFormatException(id.fileName(), "segment failed to decode earlier in this session");
        }
        final long start = System.nanoTime();
        final byte[] payload = boundedLoad(id);
        final BitmapSegment loaded;
        try {
            loaded = BitmapSegment.deserialize(id.fileName(), payload);
        } catch (IndexFormatException e) {
            undecodable.add(id);
            log.warn("Segment {} is corrupt: {}", id, e.getMessage());
            throw e;
        }
        if (loaded.low() != id.low() || loaded.size() != id.size()) {
            undecodable.add(id);
            throw new IndexFormatException(id.fileName(),
                    "header declares [" + loaded.low() + ", " + loaded.highExclusive() + ")");
        }
        final Roaring64Bitmap evaluated = matcher.match(loaded::lookup);
        segment = loaded;
        matches = evaluated;
        final long micros = (System.nanoTime() - start) / 1_000;
        DebugLogger.logIndex(LogFormatter.formatSegmentLoad(
                id.fileName(), loaded.keyCount(), evaluated.getLongCardinality(), micros));
    }

    /**
     * @param blockNum a block number
     * @return whether the filter may match {@code blockNum}
     * @throws IndexUnavailableException if no segment covers {@code blockNum}
     * @throws IndexFormatException      if the covering segment cannot be decoded
     * @throws SegmentStoreException     if the read fails or exceeds the load timeout
     */
    public synchronized boolean matches(final long blockNum) {
        loadIfNeeded(blockNum);
        return matches.contains(blockNum);
    }

    /**
     * Equivalent to {@code nextMatching(blockNum, Long.MAX_VALUE)}.
     */
    public synchronized NextMatch nextMatching(final long blockNum) {
        return nextMatching(blockNum, Long.MAX_VALUE);
    }

    /**
     * Finds the first candidate at or after {@code blockNum} within the segment covering
     * {@code blockNum}, bounded by {@code exclusiveUpTo}.
     *
     * <p>If there is none, the result carries {@code exhaustedRange = true} and the
     * smaller of the segment's upper boundary and {@code exclusiveUpTo}: every block
     * before that number can be skipped.
     *
     * @throws IndexUnavailableException if no segment covers {@code blockNum}
     * @throws IndexFormatException      if the covering segment cannot be decoded
     * @throws SegmentStoreException     if the read fails or exceeds the load timeout
     */
    public synchronized NextMatch nextMatching(final long blockNum, final long exclusiveUpTo) {
        loadIfNeeded(blockNum);
        final long bound = Math.min(segment.highExclusive(), exclusiveUpTo);
        // rank of blockNum - 1 is the position of the first candidate >= blockNum
        final long before = blockNum == 0 ? 0 : matches.rankLong(blockNum - 1);
        if (before < matches.getLongCardinality()) {
            final long candidate = matches.select(before);
            if (candidate < bound) {
                return new NextMatch(candidate, false);
            }
        }
        return new NextMatch(Math.max(bound, blockNum), true);
    }

    /**
     * @return identity of the loaded segment, or {@code null} before the first load
     */
    public synchronized @Nullable SegmentId loadedSegment() {
        return segment == null ? null : segment.id(kind);
    }

    private @Nullable SegmentId locate(final long blockNum) {
        for (Long size : possibleIndexSizes) {
            final SegmentId id = SegmentId.covering(blockNum, size, kind);
            final boolean exists = StoreDeadline.call(
                    "Probing segment " + id,
                    () -> StoreRetry.run("probe " + id, () -> store.exists(id), config.maxStoreAttempts(), config.retry()),
                    config.loadTimeout());
            if (exists) {
                return id;
            }
        }
        return null;
    }

    private byte[] boundedLoad(final SegmentId id) {
        return StoreDeadline.call(
                "Loading segment " + id,
                () -> StoreRetry.run("open " + id, () -> store.open(id), config.maxStoreAttempts(), config.retry()),
                config.loadTimeout());
    }
}
