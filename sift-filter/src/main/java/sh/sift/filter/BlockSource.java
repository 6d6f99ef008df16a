// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.filter;

import org.jspecify.annotations.Nullable;

import sh.sift.core.model.Block;

/**
 * Supplies decoded blocks by number.
 *
 * <p>Blocks must honor the preconditions documented on {@link Block} and its parts.
 */
@FunctionalInterface
public interface BlockSource {

    /**
     * @param blockNum block number
     * @return the decoded block, or {@code null} if the chain has no block at that number
     */
    @Nullable Block fetch(long blockNum);
}
