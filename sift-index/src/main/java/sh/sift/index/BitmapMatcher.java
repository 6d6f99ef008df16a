// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.index;

import org.roaringbitmap.longlong.Roaring64Bitmap;

/**
 * A filter compiled to bitmap algebra.
 *
 * <p>Given the bitmaps of one segment, a matcher returns every block number in that
 * segment that may satisfy the filter. It may over-approximate but must never miss a
 * block the exact filter would keep.
 */
@FunctionalInterface
public interface BitmapMatcher {

    /**
     * @param lookup bitmap source for one segment
     * @return the candidate block numbers; never {@code null}, possibly empty
     */
    Roaring64Bitmap match(BitmapLookup lookup);
}
