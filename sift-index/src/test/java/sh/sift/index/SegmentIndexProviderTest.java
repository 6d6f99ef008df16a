// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.index;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static sh.sift.index.IndexFixtures.*;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.roaringbitmap.longlong.Roaring64Bitmap;

import sh.sift.core.error.IndexFormatException;
import sh.sift.core.error.IndexUnavailableException;
import sh.sift.core.error.SegmentStoreException;
import sh.sift.index.store.InMemorySegmentStore;
import sh.sift.index.store.SegmentId;
import sh.sift.index.store.SegmentStore;
import sh.sift.index.store.StoreRetryConfig;

@ExtendWith(MockitoExtension.class)
class SegmentIndexProviderTest {

    private static final StoreRetryConfig FAST_RETRY = StoreRetryConfig.builder()
            .backoffBaseMs(1)
            .backoffMaxMs(1)
            .build();
    private static final IndexConfig CONFIG = IndexConfig.builder()
            .indexSize(10)
            .possibleIndexSizes(List.of(10L))
            .retry(FAST_RETRY)
            .maxStoreAttempts(1)
            .build();

    private static final BitmapMatcher TOKEN_LOGS = lookup -> {
        Roaring64Bitmap hits = lookup.get("L" + TOKEN.keyHex());
        return hits == null ? new Roaring64Bitmap() : hits;
    };

    @Mock
    private SegmentStore mockStore;

    private InMemorySegmentStore store;

    @BeforeEach
    void setUp() {
        store = new InMemorySegmentStore();
        // token logs in 12 and 17, nothing else in [10, 20); [20, 30) has no token logs
        SegmentIndexer indexer = new SegmentIndexer(store, IndexKind.COMBINED, CONFIG);
        for (long n = 10; n < 31; n++) {
            if (n == 12 || n == 17) {
                indexer.ingest(block(n, logTrace(TOKEN, TRANSFER)));
            } else {
                indexer.ingest(block(n, logTrace(ROUTER)));
            }
        }
        indexer.close();
    }

    @Test
    void withinRangeReflectsPublishedSegments() {
        SegmentIndexProvider provider = new SegmentIndexProvider(store, IndexKind.COMBINED, TOKEN_LOGS, CONFIG);

        assertTrue(provider.withinRange(10));
        assertTrue(provider.withinRange(29));
        assertFalse(provider.withinRange(30));
        assertFalse(provider.withinRange(5));
    }

    @Test
    void matchesConsultsCachedSegment() {
        SegmentIndexProvider provider = new SegmentIndexProvider(store, IndexKind.COMBINED, TOKEN_LOGS, CONFIG);

        assertTrue(provider.matches(12));
        assertFalse(provider.matches(13));
        assertTrue(provider.matches(17));
        assertEquals(new SegmentId(10, 10, "combined"), provider.loadedSegment());

        assertFalse(provider.matches(25));
        assertEquals(new SegmentId(20, 10, "combined"), provider.loadedSegment());
    }

    @Test
    void nextMatchingWalksCandidatesThenExhausts() {
        SegmentIndexProvider provider = new SegmentIndexProvider(store, IndexKind.COMBINED, TOKEN_LOGS, CONFIG);

        assertEquals(new NextMatch(12, false), provider.nextMatching(10));
        assertEquals(new NextMatch(12, false), provider.nextMatching(12));
        assertEquals(new NextMatch(17, false), provider.nextMatching(13));
        assertEquals(new NextMatch(20, true), provider.nextMatching(18));
        assertEquals(new NextMatch(30, true), provider.nextMatching(20));
    }

    @Test
    void nextMatchingHonorsExclusiveUpperBound() {
        SegmentIndexProvider provider = new SegmentIndexProvider(store, IndexKind.COMBINED, TOKEN_LOGS, CONFIG);

        assertEquals(new NextMatch(15, true), provider.nextMatching(13, 15));
        assertEquals(new NextMatch(17, false), provider.nextMatching(13, 18));
        assertEquals(new NextMatch(17, true), provider.nextMatching(13, 17));
    }

    @Test
    void missingSegmentIsUnavailable() {
        SegmentIndexProvider provider = new SegmentIndexProvider(store, IndexKind.COMBINED, TOKEN_LOGS, CONFIG);

        IndexUnavailableException ex = assertThrows(IndexUnavailableException.class, () -> provider.matches(69));

        assertEquals(69, ex.blockNum());
        assertEquals("combined", ex.kind());
        assertEquals(List.of(10L), ex.probedSizes());
    }

    @Test
    void segmentsOfOtherKindsAreInvisible() {
        SegmentIndexProvider provider = new SegmentIndexProvider(store, IndexKind.LOG, TOKEN_LOGS, CONFIG);

        assertFalse(provider.withinRange(12));
    }

    @Test
    void probesSizesInOrder() {
        InMemorySegmentStore mixed = new InMemorySegmentStore();
        BitmapSegment large = new BitmapSegment(0, 1000);
        large.add("L" + TOKEN.keyHex(), 512);
        mixed.write(large.id("combined"), large.serialize());
        IndexConfig config = IndexConfig.builder()
                .possibleIndexSizes(List.of(100L, 1000L))
                .retry(FAST_RETRY)
                .build();

        SegmentIndexProvider provider = new SegmentIndexProvider(mixed, IndexKind.COMBINED, TOKEN_LOGS, config);

        assertTrue(provider.matches(512));
        assertEquals(new SegmentId(0, 1000, "combined"), provider.loadedSegment());
    }

    @Test
    void corruptSegmentFailsWithFormatError() {
        SegmentId id = new SegmentId(0, 10, "combined");
        when(mockStore.exists(id)).thenReturn(true);
        when(mockStore.open(id)).thenReturn(new byte[] {1, 2, 3});
        SegmentIndexProvider provider = new SegmentIndexProvider(mockStore, IndexKind.COMBINED, TOKEN_LOGS, CONFIG);

        IndexFormatException ex = assertThrows(IndexFormatException.class, () -> provider.matches(3));

        assertEquals("0000000000.10.combined.idx", ex.segment());
        assertNull(provider.loadedSegment());
    }

    @Test
    void undecodableSegmentIsFetchedOnlyOnce() {
        SegmentId id = new SegmentId(0, 10, "combined");
        when(mockStore.exists(id)).thenReturn(true);
        when(mockStore.open(id)).thenReturn(new byte[] {1, 2, 3});
        SegmentIndexProvider provider = new SegmentIndexProvider(mockStore, IndexKind.COMBINED, TOKEN_LOGS, CONFIG);

        assertThrows(IndexFormatException.class, () -> provider.matches(3));
        IndexFormatException again = assertThrows(IndexFormatException.class, () -> provider.nextMatching(7));

        assertEquals("0000000000.10.combined.idx", again.segment());
        verify(mockStore, times(1)).open(id);
    }

    @Test
    void segmentWhoseHeaderDisagreesWithItsNameIsRejected() {
        BitmapSegment other = new BitmapSegment(10, 10);
        when(mockStore.exists(any())).thenReturn(true);
        when(mockStore.open(any())).thenReturn(other.serialize());
        SegmentIndexProvider provider = new SegmentIndexProvider(mockStore, IndexKind.COMBINED, TOKEN_LOGS, CONFIG);

        assertThrows(IndexFormatException.class, () -> provider.matches(3));
    }

    @Test
    void transientReadFailureIsRetried() {
        BitmapSegment segment = new BitmapSegment(0, 10);
        segment.add("L" + TOKEN.keyHex(), 4);
        IndexConfig retrying = IndexConfig.builder()
                .indexSize(10)
                .possibleIndexSizes(List.of(10L))
                .retry(FAST_RETRY)
                .maxStoreAttempts(3)
                .build();
        when(mockStore.exists(any())).thenReturn(true);
        when(mockStore.open(any()))
                .thenThrow(new SegmentStoreException("connection reset", true))
                .thenReturn(segment.serialize());
        SegmentIndexProvider provider = new SegmentIndexProvider(mockStore, IndexKind.COMBINED, TOKEN_LOGS, retrying);

        assertTrue(provider.matches(4));
        verify(mockStore, times(2)).open(any());
    }

    @Test
    void slowLoadTimesOut() {
        SegmentStore slow = new SegmentStore() {
            @Override
            public boolean exists(SegmentId id) {
                return true;
            }

            @Override
            public void write(SegmentId id, byte[] payload) {
                throw new UnsupportedOperationException();
            }

            @Override
            public byte[] open(SegmentId id) {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return new byte[0];
            }
        };
        IndexConfig config = IndexConfig.builder()
                .possibleIndexSizes(List.of(10L))
                .loadTimeout(Duration.ofMillis(50))
                .retry(FAST_RETRY)
                .build();
        SegmentIndexProvider provider = new SegmentIndexProvider(slow, IndexKind.COMBINED, TOKEN_LOGS, config);

        SegmentStoreException ex = assertThrows(SegmentStoreException.class, () -> provider.matches(3));

        assertTrue(ex.isTimeout());
        assertTrue(ex.isRetryable());
    }

    @Test
    void slowExistenceProbeTimesOut() {
        SegmentStore slow = new SegmentStore() {
            @Override
            public boolean exists(SegmentId id) {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return true;
            }

            @Override
            public void write(SegmentId id, byte[] payload) {
                throw new UnsupportedOperationException();
            }

            @Override
            public byte[] open(SegmentId id) {
                throw new UnsupportedOperationException();
            }
        };
        IndexConfig config = IndexConfig.builder()
                .possibleIndexSizes(List.of(10L))
                .loadTimeout(Duration.ofMillis(50))
                .retry(FAST_RETRY)
                .build();
        SegmentIndexProvider provider = new SegmentIndexProvider(slow, IndexKind.COMBINED, TOKEN_LOGS, config);

        SegmentStoreException ex = assertTimeout(Duration.ofSeconds(2),
                () -> assertThrows(SegmentStoreException.class, () -> provider.withinRange(3)));

        assertTrue(ex.isTimeout());
        assertTrue(ex.isRetryable());
    }

    @Test
    void nextMatchingSeeksWithinDenseSegment() {
        long size = 100_000;
        BitmapSegment dense = new BitmapSegment(0, size);
        for (long n = 0; n < size; n++) {
            if (n % 3 != 1) {
                dense.add("L" + TOKEN.keyHex(), n);
            }
        }
        InMemorySegmentStore denseStore = new InMemorySegmentStore();
        denseStore.write(dense.id("combined"), dense.serialize());
        IndexConfig config = IndexConfig.builder()
                .indexSize(size)
                .possibleIndexSizes(List.of(size))
                .retry(FAST_RETRY)
                .build();
        SegmentIndexProvider provider = new SegmentIndexProvider(denseStore, IndexKind.COMBINED, TOKEN_LOGS, config);

        assertTimeout(Duration.ofSeconds(10), () -> {
            for (long n = 0; n < size; n++) {
                long expected = n % 3 == 1 ? n + 1 : n;
                assertEquals(new NextMatch(expected, false), provider.nextMatching(n));
            }
        });
    }
}
