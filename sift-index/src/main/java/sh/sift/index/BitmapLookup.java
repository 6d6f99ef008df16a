// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.index;

import org.jspecify.annotations.Nullable;
import org.roaringbitmap.longlong.Roaring64Bitmap;

/**
 * Key to bitmap resolution against one loaded segment.
 */
@FunctionalInterface
public interface BitmapLookup {

    /**
     * @param key an index key
     * @return the blocks containing {@code key}, or {@code null} if none do
     */
    @Nullable Roaring64Bitmap get(String key);
}
