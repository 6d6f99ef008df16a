// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.filter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import org.jspecify.annotations.Nullable;

import sh.sift.core.error.FilterConfigurationException;
import sh.sift.core.types.Address;
import sh.sift.core.types.Signature;

/**
 * Shared state of {@link LogFilter} and {@link CallFilter}. Sets keep their input order so
 * rendering is stable.
 */
abstract sealed class AddressSignatureFilter implements FilterClause permits LogFilter, CallFilter {

    private final Set<Address> addresses;
    private final Set<Signature> signatures;
    private final Set<String> signatureKeys;

    AddressSignatureFilter(final Collection<Address> addresses, final Collection<Signature> signatures) {
        Objects.requireNonNull(addresses, "addresses");
        Objects.requireNonNull(signatures, "signatures");
        if (addresses.isEmpty() && signatures.isEmpty()) {
            throw new FilterConfigurationException(
                    getClass().getSimpleName() + " requires at least one address or signature");
        }
        this.addresses = Collections.unmodifiableSet(new LinkedHashSet<>(addresses));
        this.signatures = Collections.unmodifiableSet(new LinkedHashSet<>(signatures));
        final Set<String> keys = new LinkedHashSet<>();
        for (Signature signature : this.signatures) {
            keys.add(signature.keyHex());
        }
        this.signatureKeys = Collections.unmodifiableSet(keys);
    }

    @Override
    public Set<Address> addresses() {
        return addresses;
    }

    @Override
    public Set<Signature> signatures() {
        return signatures;
    }

    final boolean matchesAddress(final Address address) {
        return addresses.isEmpty() || addresses.contains(address);
    }

    final boolean matchesSignature(final @Nullable String keyHex) {
        if (signatureKeys.isEmpty()) {
            return true;
        }
        return keyHex != null && signatureKeys.contains(keyHex);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        final AddressSignatureFilter other = (AddressSignatureFilter) o;
        return addresses.equals(other.addresses) && signatures.equals(other.signatures);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), addresses, signatures);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + render();
    }
}
