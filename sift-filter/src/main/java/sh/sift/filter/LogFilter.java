// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.filter;

import java.util.Collection;
import java.util.List;

import sh.sift.core.error.FilterConfigurationException;
import sh.sift.core.model.LogEntry;
import sh.sift.core.model.TransactionTrace;
import sh.sift.core.types.Address;
import sh.sift.core.types.Hash;
import sh.sift.core.types.Signature;
import sh.sift.index.KeyOrigin;

/**
 * Matches a trace when one receipt log has a listed address and a listed event signature
 * as {@code topics[0]}.
 */
public final class LogFilter extends AddressSignatureFilter {

    /**
     * @throws FilterConfigurationException if both collections are empty
     */
    public LogFilter(final Collection<Address> addresses, final Collection<Signature> eventSignatures) {
        super(addresses, eventSignatures);
    }

    public static LogFilter ofAddresses(final Address... addresses) {
        return new LogFilter(List.of(addresses), List.of());
    }

    public static LogFilter ofSignatures(final Signature... eventSignatures) {
        return new LogFilter(List.of(), List.of(eventSignatures));
    }

    @Override
    public KeyOrigin origin() {
        return KeyOrigin.LOG;
    }

    @Override
    public boolean matches(final TransactionTrace trace) {
        for (LogEntry log : trace.receipt().logs()) {
            if (!matchesAddress(log.address())) {
                continue;
            }
            final Hash topic = log.eventSignature();
            if (matchesSignature(topic == null ? null : topic.keyHex())) {
                return true;
            }
        }
        return false;
    }
}
