// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.error;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.Test;

class SiftExceptionTest {

    @Test
    void indexUnavailableDescribesProbedSizes() {
        IndexUnavailableException e = new IndexUnavailableException(69, "combined", List.of(2L, 100L));
        assertEquals(69, e.blockNum());
        assertEquals(List.of(2L, 100L), e.probedSizes());
        assertTrue(e.getMessage().contains("block 69"));
        assertInstanceOf(SiftException.class, e);
    }

    @Test
    void formatErrorCarriesSegmentName() {
        IndexFormatException e = new IndexFormatException("0000000010.2.combined.idx", "truncated");
        assertEquals("[0000000010.2.combined.idx] truncated", e.getMessage());
        assertNull(new IndexFormatException(null, "bad").segment());
    }

    @Test
    void rangeViolationReportsBounds() {
        RangeViolationException e = new RangeViolationException("aa", 250, 100, 100);
        assertTrue(e.getMessage().contains("[100, 200)"));
        assertEquals(250, e.blockNum());
    }

    @Test
    void storeErrorsKnowWhetherTheyAreRetryable() {
        SegmentStoreException timeout = new SegmentStoreException("Segment load timed out", true);
        assertTrue(timeout.isRetryable());
        assertTrue(timeout.isTimeout());

        RetryExhaustedException exhausted =
                new RetryExhaustedException("open 0000000010.2.combined.idx", 3, 1200, new IOException("reset"));
        assertFalse(exhausted.isRetryable());
        assertEquals(3, exhausted.attemptCount());
        assertInstanceOf(IOException.class, exhausted.getCause());
        assertTrue(exhausted.getMessage().contains("after 3 attempts"));
    }
}
