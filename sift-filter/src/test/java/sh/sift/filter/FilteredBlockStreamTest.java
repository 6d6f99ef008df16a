// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.filter;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static sh.sift.filter.TestBlocks.*;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.sift.core.error.SegmentStoreException;
import sh.sift.core.model.Block;
import sh.sift.index.IndexConfig;
import sh.sift.index.IndexKind;
import sh.sift.index.SegmentIndexProvider;
import sh.sift.index.store.InMemorySegmentStore;
import sh.sift.index.store.SegmentId;
import sh.sift.index.store.StoreRetryConfig;

@ExtendWith(MockitoExtension.class)
class FilteredBlockStreamTest {

    private static final IndexConfig SIZE_10 = IndexConfig.builder()
            .indexSize(10)
            .possibleIndexSizes(List.of(10L))
            .maxStoreAttempts(1)
            .retry(StoreRetryConfig.builder().backoffBaseMs(1).backoffMaxMs(1).build())
            .build();

    private final List<Block> chain = new ArrayList<>();

    @Mock
    private SegmentIndexProvider brokenProvider;

    @BeforeEach
    void setUp() {
        // 0-29: token logs at 3, 17 and 25, noise elsewhere
        for (long n = 0; n < 30; n++) {
            if (n == 3 || n == 17 || n == 25) {
                chain.add(block(n, logTrace(n, log(ADDR_A, TOPIC_A))));
            } else {
                chain.add(block(n, logTrace(n, log(ADDR_B))));
            }
        }
    }

    @Test
    void skipsRangesWithoutCandidates() {
        InMemorySegmentStore store = new InMemorySegmentStore();
        index(store, IndexKind.COMBINED, SIZE_10, chain, true);
        CombinedFilter filter = filterFor(store, false);
        List<Block> out = new ArrayList<>();

        StreamStats stats = new FilteredBlockStream(source(chain), filter).stream(0, 30, out::add);

        assertEquals(List.of(3L, 17L, 25L), numbers(out));
        assertEquals(3, stats.decoded());
        assertEquals(27, stats.skipped());
        assertEquals(0, stats.fallbacks());
    }

    @Test
    void indexedAndExactStreamsAgree() {
        InMemorySegmentStore store = new InMemorySegmentStore();
        index(store, IndexKind.COMBINED, SIZE_10, chain, true);
        List<Block> indexed = new ArrayList<>();
        List<Block> exact = new ArrayList<>();

        new FilteredBlockStream(source(chain), filterFor(store, false)).stream(2, 26, indexed::add);
        new FilteredBlockStream(source(chain), filterFor(null, false)).stream(2, 26, exact::add);

        assertEquals(exact, indexed);
        assertEquals(List.of(3L, 17L, 25L), numbers(indexed));
    }

    @Test
    void alwaysEmitHeaderFillsSkippedNumbers() {
        InMemorySegmentStore store = new InMemorySegmentStore();
        index(store, IndexKind.COMBINED, SIZE_10, chain, true);
        List<Block> out = new ArrayList<>();

        new FilteredBlockStream(source(chain), filterFor(store, true)).stream(0, 20, out::add);

        assertEquals(20, out.size());
        for (int i = 0; i < 20; i++) {
            Block block = out.get(i);
            assertEquals(i, block.number());
            assertEquals(i == 3 || i == 17 ? 1 : 0, block.transactionTraces().size(), "block " + i);
        }
    }

    @Test
    void uncoveredRangeIsDecodedExactly() {
        InMemorySegmentStore store = new InMemorySegmentStore();
        // only [0, 10) published; the partial tail is discarded
        index(store, IndexKind.COMBINED, SIZE_10, chain.subList(0, 15), false);
        List<Block> out = new ArrayList<>();

        StreamStats stats = new FilteredBlockStream(source(chain), filterFor(store, false)).stream(0, 30, out::add);

        assertEquals(List.of(3L, 17L, 25L), numbers(out));
        assertEquals(9, stats.skipped());
        assertEquals(21, stats.decoded());
    }

    @Test
    void indexFailureFallsBackWithoutLosingMatches() {
        when(brokenProvider.withinRange(anyLong()))
                .thenThrow(new SegmentStoreException("Loading segment timed out", true));
        when(brokenProvider.config()).thenReturn(SIZE_10);
        CombinedFilter filter = filterFor(null, false);
        List<Block> out = new ArrayList<>();

        StreamStats stats = new FilteredBlockStream(source(chain), filter, brokenProvider, false)
                .stream(0, 30, out::add);

        assertEquals(List.of(3L, 17L, 25L), numbers(out));
        assertEquals(30, stats.decoded());
        assertEquals(3, stats.fallbacks());
        verify(brokenProvider, never()).nextMatching(anyLong(), anyLong());
    }

    @Test
    void corruptSegmentFallsBack() {
        InMemorySegmentStore store = new InMemorySegmentStore();
        store.write(new SegmentId(0, 10, "combined"), new byte[] {0, 1, 2});
        List<Block> out = new ArrayList<>();

        StreamStats stats = new FilteredBlockStream(source(chain), filterFor(store, false))
                .stream(0, 10, out::add);

        assertEquals(List.of(3L), numbers(out));
        assertEquals(1, stats.fallbacks());
        assertEquals(10, stats.decoded());
    }

    @Test
    void missingBlocksAreSkippedSilently() {
        List<Block> sparse = List.of(chain.get(2), chain.get(3), chain.get(5));
        List<Block> out = new ArrayList<>();

        StreamStats stats = new FilteredBlockStream(source(sparse), filterFor(null, false)).stream(0, 10, out::add);

        assertEquals(List.of(3L), numbers(out));
        assertEquals(3, stats.decoded());
    }

    @Test
    void rejectsInvertedRange() {
        FilteredBlockStream stream = new FilteredBlockStream(source(chain), filterFor(null, false));

        assertThrows(IllegalArgumentException.class, () -> stream.stream(10, 5, b -> { }));
    }

    private static CombinedFilter filterFor(InMemorySegmentStore store, boolean alwaysEmitHeader) {
        CombinedFilter.Builder builder = CombinedFilter.builder()
                .logFilter(new LogFilter(List.of(ADDR_A), List.of(sig(TOPIC_A))))
                .alwaysEmitHeader(alwaysEmitHeader)
                .indexConfig(SIZE_10);
        if (store != null) {
            builder.indexStore(store);
        }
        return builder.build();
    }

    private static List<Long> numbers(List<Block> blocks) {
        return blocks.stream().map(Block::number).collect(Collectors.toList());
    }
}
