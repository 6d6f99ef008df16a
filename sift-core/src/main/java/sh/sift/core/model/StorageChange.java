// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.model;

import java.util.Objects;

import sh.sift.core.types.Address;
import sh.sift.core.types.Hash;

/**
 * A contract storage slot write performed by a call.
 */
public record StorageChange(Address address, Hash key, Hash oldValue, Hash newValue, long ordinal) {

    public StorageChange {
        Objects.requireNonNull(address, "address cannot be null");
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(oldValue, "oldValue cannot be null");
        Objects.requireNonNull(newValue, "newValue cannot be null");
    }
}
