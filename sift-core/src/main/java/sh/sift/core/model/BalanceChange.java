// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.model;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.sift.core.types.Address;
import sh.sift.core.types.Wei;

/**
 * A native balance change, at block level (rewards, withdrawals) or inside a call.
 *
 * @param address  the account whose balance changed
 * @param oldValue balance before the change ({@code null} for a new account)
 * @param newValue balance after the change
 * @param reason   upstream reason label, e.g. {@code "reward_mine_block"}
 * @param ordinal  execution ordinal
 */
public record BalanceChange(Address address, @Nullable Wei oldValue, Wei newValue, String reason, long ordinal) {

    public BalanceChange {
        Objects.requireNonNull(address, "address cannot be null");
        Objects.requireNonNull(newValue, "newValue cannot be null");
        Objects.requireNonNull(reason, "reason cannot be null");
    }
}
