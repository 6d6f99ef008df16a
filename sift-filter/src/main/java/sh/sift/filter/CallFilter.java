// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.filter;

import java.util.Collection;
import java.util.List;

import sh.sift.core.error.FilterConfigurationException;
import sh.sift.core.model.Call;
import sh.sift.core.model.TransactionTrace;
import sh.sift.core.types.Address;
import sh.sift.core.types.Signature;
import sh.sift.index.KeyOrigin;

/**
 * Matches a trace when one of its calls targets a listed address with a listed 4-byte
 * method selector.
 */
public final class CallFilter extends AddressSignatureFilter {

    /**
     * @throws FilterConfigurationException if both collections are empty
     */
    public CallFilter(final Collection<Address> addresses, final Collection<Signature> signatures) {
        super(addresses, signatures);
    }

    public static CallFilter ofAddresses(final Address... addresses) {
        return new CallFilter(List.of(addresses), List.of());
    }

    public static CallFilter ofSignatures(final Signature... signatures) {
        return new CallFilter(List.of(), List.of(signatures));
    }

    @Override
    public KeyOrigin origin() {
        return KeyOrigin.CALL;
    }

    @Override
    public boolean matches(final TransactionTrace trace) {
        for (Call call : trace.calls()) {
            if (matchesAddress(call.address()) && matchesSignature(call.methodKeyHex())) {
                return true;
            }
        }
        return false;
    }
}
