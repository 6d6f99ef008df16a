// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.filter;

import java.util.Set;
import java.util.stream.Collectors;

import sh.sift.core.model.TransactionTrace;
import sh.sift.core.types.Address;
import sh.sift.core.types.Signature;
import sh.sift.index.KeyOrigin;

/**
 * One (addresses, signatures) constraint over either the logs or the calls of a trace.
 *
 * <p>An empty dimension does not constrain; at least one dimension is non-empty.
 */
public interface FilterClause {

    KeyOrigin origin();

    Set<Address> addresses();

    Set<Signature> signatures();

    /**
     * Exact test: some single log (or call) of {@code trace} satisfies both dimensions.
     */
    boolean matches(TransactionTrace trace);

    /**
     * @return {@code {addrs: 0x..,0x.., sigs: 0x..}}
     */
    default String render() {
        return "{addrs: " + addresses().stream().map(Address::value).collect(Collectors.joining(","))
                + ", sigs: " + signatures().stream().map(Signature::value).collect(Collectors.joining(","))
                + "}";
    }
}
