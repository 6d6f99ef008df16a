// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.filter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.sift.core.DebugLogger;
import sh.sift.core.LogFormatter;
import sh.sift.core.error.FilterConfigurationException;
import sh.sift.core.model.Block;
import sh.sift.core.model.TransactionTrace;
import sh.sift.index.IndexConfig;
import sh.sift.index.IndexKind;
import sh.sift.index.KeyOrigin;
import sh.sift.index.SegmentIndexProvider;
import sh.sift.index.store.SegmentStore;

/**
 * Call and log clauses evaluated together against each trace of a block.
 *
 * <p>
 * A trace is kept when any clause matches it exactly. When no trace of a block is kept,
 * the block is either suppressed or, with {@code alwaysEmitHeader}, delivered as a
 * {@linkplain BlockProjections#headerOnly(Block) header-only} block so consumers can
 * follow chain progress.
 *
 * <p>
 * Given a segment store, the filter also compiles an index provider that lets a stream
 * skip ranges in which no clause can match. The index only ever narrows what gets
 * decoded; every delivered trace has passed {@link #matchesTrace(TransactionTrace)}.
 *
 * <pre>{@code
 * CombinedFilter filter = CombinedFilter.builder()
 *     .logFilter(LogFilter.ofAddresses(usdc))
 *     .callFilter(CallFilter.ofSignatures(new Signature("0xa9059cbb")))
 *     .alwaysEmitHeader(true)
 *     .indexStore(store)
 *     .build();
 * }</pre>
 *
 * <p>Immutable and safe to share across threads.
 */
public final class CombinedFilter implements BlockTransform {

    private static final Logger log = LoggerFactory.getLogger(CombinedFilter.class);
    private static final int RENDER_LIMIT = 90;
    private static final String RENDER_SUFFIX = "...}";

    private final List<CallFilter> callFilters;
    private final List<LogFilter> logFilters;
    private final boolean alwaysEmitHeader;
    private final @Nullable SegmentStore indexStore;
    private final IndexConfig indexConfig;
    private final IndexKind indexKind;

    /**
     * @throws FilterConfigurationException if both clause lists are empty
     */
    public CombinedFilter(
            final List<CallFilter> callFilters,
            final List<LogFilter> logFilters,
            final boolean alwaysEmitHeader,
            final @Nullable SegmentStore indexStore,
            final IndexConfig indexConfig,
            final IndexKind indexKind) {
        this.callFilters = List.copyOf(Objects.requireNonNull(callFilters, "callFilters"));
        this.logFilters = List.copyOf(Objects.requireNonNull(logFilters, "logFilters"));
        if (this.callFilters.isEmpty() && this.logFilters.isEmpty()) {
            throw new FilterConfigurationException("A combined filter requires at least one call or log filter");
        }
        this.alwaysEmitHeader = alwaysEmitHeader;
        this.indexStore = indexStore;
        this.indexConfig = Objects.requireNonNull(indexConfig, "indexConfig");
        this.indexKind = Objects.requireNonNull(indexKind, "indexKind");
    }

    public List<CallFilter> callFilters() {
        return callFilters;
    }

    public List<LogFilter> logFilters() {
        return logFilters;
    }

    public boolean alwaysEmitHeader() {
        return alwaysEmitHeader;
    }

    /**
     * @return whether any log or call clause matches {@code trace}
     */
    public boolean matchesTrace(final TransactionTrace trace) {
        for (LogFilter filter : logFilters) {
            if (filter.matches(trace)) {
                return true;
            }
        }
        for (CallFilter filter : callFilters) {
            if (filter.matches(trace)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Keeps the matching traces of {@code block}.
     *
     * @return the block with only matching traces; the header-only projection if none
     *         match and {@code alwaysEmitHeader} is set
     */
    public Block transform(final Block block) {
        final List<TransactionTrace> kept = new ArrayList<>();
        for (TransactionTrace trace : block.transactionTraces()) {
            if (matchesTrace(trace)) {
                kept.add(trace);
            }
        }
        DebugLogger.logFilter(LogFormatter.formatFilterResult(
                block.number(), block.hash().value(), kept.size(), block.transactionTraces().size()));
        if (kept.isEmpty() && alwaysEmitHeader) {
            return BlockProjections.headerOnly(block);
        }
        return block.withTransactionTraces(kept);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Empty when no trace matches and {@code alwaysEmitHeader} is not set.
     */
    @Override
    public Optional<Block> apply(final Block block) {
        final Block transformed = transform(block);
        if (transformed.transactionTraces().isEmpty() && !alwaysEmitHeader) {
            return Optional.empty();
        }
        return Optional.of(transformed);
    }

    /**
     * Builds the index provider for this filter.
     *
     * @return the provider, or {@code null} if no store is configured or the configured
     *         index kind does not hold keys for every clause origin in use
     */
    public @Nullable SegmentIndexProvider compileIndexProvider() {
        if (indexStore == null) {
            return null;
        }
        if ((!callFilters.isEmpty() && !indexKind.covers(KeyOrigin.CALL))
                || (!logFilters.isEmpty() && !indexKind.covers(KeyOrigin.LOG))) {
            log.debug("Index kind {} cannot serve {}; streaming without index", indexKind.shortname(), this);
            return null;
        }
        return new SegmentIndexProvider(
                indexStore, indexKind, ClauseBitmaps.matcher(callFilters, logFilters, indexKind), indexConfig);
    }

    @Override
    public String toString() {
        final String calls = callFilters.stream().map(FilterClause::render).collect(Collectors.joining(","));
        final String logs = logFilters.stream().map(FilterClause::render).collect(Collectors.joining(","));
        return "Combined filter: Calls:[" + truncate(calls) + "], Logs:[" + truncate(logs) + "]";
    }

    static String truncate(final String rendered) {
        if (rendered.length() < RENDER_LIMIT) {
            return rendered;
        }
        return rendered.substring(0, RENDER_LIMIT) + RENDER_SUFFIX;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link CombinedFilter}. Without an index store the filter runs without
     * index assistance; the index kind defaults to {@link IndexKind#COMBINED}.
     */
    public static final class Builder {
        private final List<CallFilter> callFilters = new ArrayList<>();
        private final List<LogFilter> logFilters = new ArrayList<>();
        private boolean alwaysEmitHeader;
        private SegmentStore indexStore;
        private IndexConfig indexConfig = IndexConfig.defaults();
        private IndexKind indexKind = IndexKind.COMBINED;

        private Builder() {}

        public Builder callFilter(final CallFilter filter) {
            callFilters.add(Objects.requireNonNull(filter, "filter"));
            return this;
        }

        public Builder callFilters(final List<CallFilter> filters) {
            filters.forEach(this::callFilter);
            return this;
        }

        public Builder logFilter(final LogFilter filter) {
            logFilters.add(Objects.requireNonNull(filter, "filter"));
            return this;
        }

        public Builder logFilters(final List<LogFilter> filters) {
            filters.forEach(this::logFilter);
            return this;
        }

        public Builder alwaysEmitHeader(final boolean alwaysEmitHeader) {
            this.alwaysEmitHeader = alwaysEmitHeader;
            return this;
        }

        public Builder indexStore(final SegmentStore indexStore) {
            this.indexStore = indexStore;
            return this;
        }

        public Builder indexConfig(final IndexConfig indexConfig) {
            this.indexConfig = indexConfig;
            return this;
        }

        public Builder indexKind(final IndexKind indexKind) {
            this.indexKind = indexKind;
            return this;
        }

        /**
         * @throws FilterConfigurationException if no clause was added
         */
        public CombinedFilter build() {
            return new CombinedFilter(callFilters, logFilters, alwaysEmitHeader, indexStore, indexConfig, indexKind);
        }
    }
}
