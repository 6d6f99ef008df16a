// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.filter.request;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.jspecify.annotations.Nullable;

import sh.sift.core.error.FilterConfigurationException;
import sh.sift.core.types.Address;
import sh.sift.core.types.Signature;
import sh.sift.filter.BlockProjections;
import sh.sift.filter.BlockSource;
import sh.sift.filter.BlockTransform;
import sh.sift.filter.CallFilter;
import sh.sift.filter.CombinedFilter;
import sh.sift.filter.FilteredBlockStream;
import sh.sift.filter.LogFilter;
import sh.sift.index.IndexConfig;
import sh.sift.index.SegmentIndexProvider;
import sh.sift.index.store.SegmentStore;

/**
 * A consumer's filter request as received on the wire.
 *
 * <pre>{@code
 * {
 *   "callFilters": [{"addresses": ["0x..."], "signatures": ["0xa9059cbb"]}],
 *   "logFilters":  [{"addresses": ["0x..."], "eventSignatures": ["0xddf2..."]}],
 *   "headerOnly": false,
 *   "sendAllBlockHeaders": true
 * }
 * }</pre>
 *
 * <p>Missing lists read as empty. Hex values are validated when the request is compiled,
 * not when it is parsed.
 *
 * @param callFilters         call clauses
 * @param logFilters          log clauses
 * @param headerOnly          deliver only block headers
 * @param sendAllBlockHeaders deliver a header-only block for every block without matches
 */
public record FilterRequest(
        @JsonProperty("callFilters") List<CallClause> callFilters,
        @JsonProperty("logFilters") List<LogClause> logFilters,
        @JsonProperty("headerOnly") boolean headerOnly,
        @JsonProperty("sendAllBlockHeaders") boolean sendAllBlockHeaders) {

    public FilterRequest {
        callFilters = callFilters == null ? List.of() : List.copyOf(callFilters);
        logFilters = logFilters == null ? List.of() : List.copyOf(logFilters);
    }

    /**
     * @param addresses  called addresses, 0x-prefixed
     * @param signatures 4-byte method selectors, 0x-prefixed
     */
    public record CallClause(
            @JsonProperty("addresses") List<String> addresses,
            @JsonProperty("signatures") List<String> signatures) {

        public CallClause {
            addresses = addresses == null ? List.of() : List.copyOf(addresses);
            signatures = signatures == null ? List.of() : List.copyOf(signatures);
        }
    }

    /**
     * @param addresses       emitting addresses, 0x-prefixed
     * @param eventSignatures {@code topics[0]} values, 0x-prefixed
     */
    public record LogClause(
            @JsonProperty("addresses") List<String> addresses,
            @JsonProperty("eventSignatures") List<String> eventSignatures) {

        public LogClause {
            addresses = addresses == null ? List.of() : List.copyOf(addresses);
            eventSignatures = eventSignatures == null ? List.of() : List.copyOf(eventSignatures);
        }
    }

    public boolean hasClauses() {
        return !callFilters.isEmpty() || !logFilters.isEmpty();
    }

    /**
     * @param indexStore  segment store, or {@code null} to run without index
     * @param indexConfig segment sizes and store settings
     * @return the combined filter, or {@code null} if the request has no clauses
     * @throws FilterConfigurationException if a clause is empty or holds invalid hex
     */
    public @Nullable CombinedFilter toCombinedFilter(
            final @Nullable SegmentStore indexStore, final IndexConfig indexConfig) {
        if (!hasClauses()) {
            return null;
        }
        final CombinedFilter.Builder builder = CombinedFilter.builder()
                .alwaysEmitHeader(sendAllBlockHeaders)
                .indexConfig(indexConfig);
        if (indexStore != null) {
            builder.indexStore(indexStore);
        }
        for (CallClause clause : callFilters) {
            builder.callFilter(new CallFilter(addresses(clause.addresses()), signatures(clause.signatures())));
        }
        for (LogClause clause : logFilters) {
            builder.logFilter(new LogFilter(addresses(clause.addresses()), signatures(clause.eventSignatures())));
        }
        return builder.build();
    }

    /**
     * Compiles the request into the transform chain applied to every decoded block: the
     * combined filter when clauses are present, then the header-only projection when
     * {@code headerOnly} is set.
     *
     * @throws FilterConfigurationException if the request selects nothing, or a clause is
     *                                      empty or holds invalid hex
     */
    public BlockTransform toTransform(final @Nullable SegmentStore indexStore, final IndexConfig indexConfig) {
        final CombinedFilter filter = toCombinedFilter(indexStore, indexConfig);
        return chain(filter);
    }

    /**
     * Compiles the request into a ready-to-run stream over {@code source}.
     *
     * @throws FilterConfigurationException as for {@link #toTransform}
     */
    public FilteredBlockStream openStream(
            final BlockSource source, final @Nullable SegmentStore indexStore, final IndexConfig indexConfig) {
        final CombinedFilter filter = toCombinedFilter(indexStore, indexConfig);
        final BlockTransform transform = chain(filter);
        final SegmentIndexProvider provider = filter == null ? null : filter.compileIndexProvider();
        return new FilteredBlockStream(source, transform, provider, filter != null && filter.alwaysEmitHeader());
    }

    private BlockTransform chain(final @Nullable CombinedFilter filter) {
        if (filter == null && !headerOnly) {
            throw new FilterConfigurationException(
                    "Filter request selects nothing: no call filters, no log filters and headerOnly not set");
        }
        if (filter == null) {
            return BlockProjections.HEADER_ONLY;
        }
        return headerOnly ? filter.andThen(BlockProjections.HEADER_ONLY) : filter;
    }

    private static List<Address> addresses(final List<String> values) {
        final List<Address> out = new ArrayList<>(values.size());
        for (String value : values) {
            try {
                out.add(new Address(value));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new FilterConfigurationException("Invalid address in filter request: " + value, e);
            }
        }
        return out;
    }

    private static List<Signature> signatures(final List<String> values) {
        final List<Signature> out = new ArrayList<>(values.size());
        for (String value : values) {
            try {
                out.add(new Signature(value));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new FilterConfigurationException("Invalid signature in filter request: " + value, e);
            }
        }
        return out;
    }
}
