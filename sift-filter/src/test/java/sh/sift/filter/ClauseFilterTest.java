// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.filter;

import static org.junit.jupiter.api.Assertions.*;
import static sh.sift.filter.TestBlocks.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import sh.sift.core.error.FilterConfigurationException;
import sh.sift.core.model.TransactionTrace;
import sh.sift.index.KeyOrigin;

class ClauseFilterTest {

    private final TransactionTrace twoLogs = logTrace(1, log(ADDR_A, SIG_3), log(ADDR_4, SIG_4));

    @Test
    void logFilterRequiresBothDimensionsOnTheSameLog() {
        assertTrue(new LogFilter(List.of(ADDR_A), List.of(sig(SIG_3))).matches(twoLogs));
        assertTrue(new LogFilter(List.of(ADDR_4), List.of(sig(SIG_4))).matches(twoLogs));
        assertFalse(new LogFilter(List.of(ADDR_A), List.of(sig(SIG_4))).matches(twoLogs));
    }

    @Test
    void emptyDimensionDoesNotConstrain() {
        assertTrue(LogFilter.ofAddresses(ADDR_4).matches(twoLogs));
        assertTrue(LogFilter.ofSignatures(sig(SIG_3)).matches(twoLogs));
        assertFalse(LogFilter.ofAddresses(ADDR_B).matches(twoLogs));
    }

    @Test
    void logWithoutTopicsFailsSignatureConstraint() {
        TransactionTrace bare = logTrace(2, log(ADDR_B));

        assertTrue(LogFilter.ofAddresses(ADDR_B).matches(bare));
        assertFalse(new LogFilter(List.of(ADDR_B), List.of(sig(SIG_3))).matches(bare));
    }

    @Test
    void callFilterMatchesAddressAndSelector() {
        TransactionTrace transfer = callTrace(3, call(ADDR_B, "0xa9059cbb00"));

        assertTrue(new CallFilter(List.of(ADDR_B), List.of(TRANSFER_SELECTOR)).matches(transfer));
        assertTrue(CallFilter.ofSignatures(TRANSFER_SELECTOR).matches(transfer));
        assertFalse(CallFilter.ofAddresses(ADDR_A).matches(transfer));
        assertFalse(CallFilter.ofSignatures(new sh.sift.core.types.Signature("0x095ea7b3")).matches(transfer));
    }

    @Test
    void callWithShortInputHasNoSelector() {
        TransactionTrace shortInput = callTrace(4, call(ADDR_B, "0xa905"));

        assertTrue(CallFilter.ofAddresses(ADDR_B).matches(shortInput));
        assertFalse(CallFilter.ofSignatures(TRANSFER_SELECTOR).matches(shortInput));
    }

    @Test
    void logFilterIgnoresCallsAndViceVersa() {
        TransactionTrace transfer = callTrace(5, call(ADDR_A, "0xa9059cbb"));

        assertFalse(LogFilter.ofAddresses(ADDR_A).matches(transfer));
        assertFalse(CallFilter.ofAddresses(ADDR_A).matches(twoLogs));
    }

    @Test
    void clauseWithoutConstraintsIsRejected() {
        assertThrows(FilterConfigurationException.class, () -> new LogFilter(List.of(), List.of()));
        assertThrows(FilterConfigurationException.class, () -> new CallFilter(List.of(), List.of()));
    }

    @Test
    void clausesExposeOriginAndRender() {
        LogFilter filter = new LogFilter(List.of(ADDR_A, ADDR_A), List.of(sig(SIG_3)));

        assertEquals(KeyOrigin.LOG, filter.origin());
        assertEquals(KeyOrigin.CALL, CallFilter.ofAddresses(ADDR_A).origin());
        assertEquals(1, filter.addresses().size());
        assertEquals("{addrs: " + ADDR_A.value() + ", sigs: " + SIG_3.value() + "}", filter.render());
        assertEquals(filter, new LogFilter(List.of(ADDR_A), List.of(sig(SIG_3))));
        assertNotEquals(LogFilter.ofAddresses(ADDR_A), CallFilter.ofAddresses(ADDR_A));
    }
}
