// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.model;

import java.util.List;
import java.util.Objects;

import sh.sift.core.types.Address;
import sh.sift.core.types.Hash;

/**
 * Entry of an EIP-2930 access list.
 *
 * @param address     the accessed account
 * @param storageKeys the accessed storage slots
 */
public record AccessTuple(Address address, List<Hash> storageKeys) {

    public AccessTuple {
        Objects.requireNonNull(address, "address cannot be null");
        Objects.requireNonNull(storageKeys, "storageKeys cannot be null");
        storageKeys = List.copyOf(storageKeys);
    }
}
