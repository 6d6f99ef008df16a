// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.model;

import java.util.Objects;

import sh.sift.core.types.Address;
import sh.sift.core.types.Hash;

/**
 * A change of the code deployed at an address.
 */
public record CodeChange(Address address, Hash oldHash, Hash newHash, long ordinal) {

    public CodeChange {
        Objects.requireNonNull(address, "address cannot be null");
        Objects.requireNonNull(oldHash, "oldHash cannot be null");
        Objects.requireNonNull(newHash, "newHash cannot be null");
    }
}
