// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.filter;

import java.util.Objects;
import java.util.Optional;

import sh.sift.core.model.Block;

/**
 * A step applied to each decoded block before delivery.
 */
@FunctionalInterface
public interface BlockTransform {

    /**
     * @param block the input block; never modified
     * @return the block to deliver, or empty to suppress delivery
     */
    Optional<Block> apply(Block block);

    /**
     * @return a transform applying {@code next} to whatever this one delivers
     */
    default BlockTransform andThen(final BlockTransform next) {
        Objects.requireNonNull(next, "next");
        return block -> apply(block).flatMap(next::apply);
    }
}
