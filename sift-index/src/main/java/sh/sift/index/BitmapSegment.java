// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.index;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;

import org.jspecify.annotations.Nullable;
import org.roaringbitmap.longlong.LongIterator;
import org.roaringbitmap.longlong.Roaring64Bitmap;

import sh.sift.core.error.IndexFormatException;
import sh.sift.core.error.RangeViolationException;
import sh.sift.index.store.SegmentId;

/**
 * Per-key block-number bitmaps for one aligned range {@code [low, low + size)}.
 *
 * <p>A segment is built by one indexer and published once; after
 * {@link #deserialize(String, byte[])} it is only read. Key order is sorted so the
 * serialized form of a given content is stable.
 *
 * <p><strong>Binary layout</strong> (big-endian):
 * <pre>
 *   magic      7 bytes  "SIFTIDX"
 *   version    1 byte   1
 *   low        8 bytes
 *   size       8 bytes
 *   keyCount   4 bytes
 *   keyCount x {
 *     keyLength    4 bytes, then UTF-8 key bytes
 *     bitmapLength 4 bytes, then the Roaring64Bitmap portable serialization
 *   }
 * </pre>
 */
public final class BitmapSegment {

    static final byte[] MAGIC = "SIFTIDX".getBytes(StandardCharsets.US_ASCII);
    static final byte FORMAT_VERSION = 1;
    private static final int MAX_KEY_LENGTH = 1024;

    private final long low;
    private final long size;
    private final TreeMap<String, Roaring64Bitmap> bitmaps = new TreeMap<>();

    /**
     * @param low  first block number, a multiple of {@code size}
     * @param size number of block numbers covered, &gt; 0
     */
    public BitmapSegment(final long low, final long size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be > 0, got: " + size);
        }
        if (low < 0 || low % size != 0) {
            throw new IllegalArgumentException("low must be a non-negative multiple of " + size + ", got: " + low);
        }
        this.low = low;
        this.size = size;
    }

    public long low() {
        return low;
    }

    public long size() {
        return size;
    }

    public long highExclusive() {
        return low + size;
    }

    public boolean covers(final long blockNum) {
        return blockNum >= low && blockNum < low + size;
    }

    public SegmentId id(final String kind) {
        return new SegmentId(low, size, kind);
    }

    /**
     * Records that {@code key} occurs in block {@code blockNum}. Adding the same pair
     * twice has no further effect.
     *
     * @throws RangeViolationException if {@code blockNum} is outside {@code [low, low + size)}
     */
    public void add(final String key, final long blockNum) {
        Objects.requireNonNull(key, "key");
        if (!covers(blockNum)) {
            throw new RangeViolationException(key, blockNum, low, size);
        }
        bitmaps.computeIfAbsent(key, k -> new Roaring64Bitmap()).addLong(blockNum);
    }

    /**
     * @param key an index key
     * @return a copy of the key's bitmap, or {@code null} if the key never occurred in this range
     */
    public @Nullable Roaring64Bitmap lookup(final String key) {
        final Roaring64Bitmap bitmap = bitmaps.get(key);
        if (bitmap == null) {
            return null;
        }
        final Roaring64Bitmap copy = new Roaring64Bitmap();
        copy.or(bitmap);
        return copy;
    }

    public SortedSet<String> keys() {
        return Collections.unmodifiableSortedSet(bitmaps.navigableKeySet());
    }

    public int keyCount() {
        return bitmaps.size();
    }

    public byte[] serialize() {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.write(MAGIC);
            out.writeByte(FORMAT_VERSION);
            out.writeLong(low);
            out.writeLong(size);
            out.writeInt(bitmaps.size());
            for (var entry : bitmaps.entrySet()) {
                final byte[] key = entry.getKey().getBytes(StandardCharsets.UTF_8);
                out.writeInt(key.length);
                out.write(key);
                final ByteArrayOutputStream bitmap = new ByteArrayOutputStream();
                entry.getValue().serialize(new DataOutputStream(bitmap));
                out.writeInt(bitmap.size());
                bitmap.writeTo(out);
            }
        } catch (IOException e) {
            throw new IllegalStateException("In-memory segment serialization failed", e);
        }
        return bytes.toByteArray();
    }

    /**
     * Decodes a serialized segment.
     *
     * @param segment name used in error messages, typically the file name
     * @param payload serialized bytes
     * @return the decoded segment
     * @throws IndexFormatException if the payload is truncated, has the wrong magic or
     *                              version, carries trailing bytes, or holds block numbers
     *                              outside its declared range
     */
    public static BitmapSegment deserialize(final String segment, final byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        final ByteArrayInputStream bytes = new ByteArrayInputStream(payload);
        final DataInputStream in = new DataInputStream(bytes);
        try {
            final byte[] magic = new byte[MAGIC.length];
            in.readFully(magic);
            if (!Arrays.equals(magic, MAGIC)) {
                throw new IndexFormatException(segment, "bad magic");
            }
            final byte version = in.readByte();
            if (version != FORMAT_VERSION) {
                throw new IndexFormatException(segment, "unsupported format version " + version);
            }
            final long low = in.readLong();
            final long size = in.readLong();
            if (size <= 0 || low < 0 || low % size != 0) {
                throw new IndexFormatException(segment, "invalid range low=" + low + " size=" + size);
            }
            final BitmapSegment result = new BitmapSegment(low, size);
            final int keyCount = in.readInt();
            if (keyCount < 0) {
                throw new IndexFormatException(segment, "negative key count " + keyCount);
            }
            for (int i = 0; i < keyCount; i++) {
                final String key = readKey(segment, in);
                final Roaring64Bitmap bitmap = readBitmap(segment, in, key);
                checkBounds(segment, key, bitmap, low, size);
                if (result.bitmaps.put(key, bitmap) != null) {
                    throw new IndexFormatException(segment, "duplicate key " + key);
                }
            }
            if (bytes.available() != 0) {
                throw new IndexFormatException(segment, bytes.available() + " trailing bytes");
            }
            return result;
        } catch (IOException e) {
            throw new IndexFormatException(segment, "truncated payload", e);
        }
    }

    private static String readKey(final String segment, final DataInputStream in) throws IOException {
        final int length = in.readInt();
        if (length <= 0 || length > MAX_KEY_LENGTH) {
            throw new IndexFormatException(segment, "invalid key length " + length);
        }
        final byte[] key = new byte[length];
        in.readFully(key);
        return new String(key, StandardCharsets.UTF_8);
    }

    private static Roaring64Bitmap readBitmap(final String segment, final DataInputStream in, final String key)
            throws IOException {
        final int length = in.readInt();
        if (length <= 0 || length > in.available()) {
            throw new IndexFormatException(segment, "invalid bitmap length " + length + " for key " + key);
        }
        final byte[] serialized = new byte[length];
        in.readFully(serialized);
        final ByteArrayInputStream slice = new ByteArrayInputStream(serialized);
        final Roaring64Bitmap bitmap = new Roaring64Bitmap();
        try {
            bitmap.deserialize(new DataInputStream(slice));
        } catch (IOException | RuntimeException e) {
            throw new IndexFormatException(segment, "corrupt bitmap for key " + key, e);
        }
        if (slice.available() != 0) {
            throw new IndexFormatException(segment, "bitmap for key " + key + " has trailing bytes");
        }
        return bitmap;
    }

    private static void checkBounds(
            final String segment, final String key, final Roaring64Bitmap bitmap, final long low, final long size) {
        if (bitmap.isEmpty()) {
            throw new IndexFormatException(segment, "empty bitmap for key " + key);
        }
        final LongIterator ascending = bitmap.getLongIterator();
        final LongIterator descending = bitmap.getReverseLongIterator();
        final long first = ascending.next();
        final long last = descending.next();
        if (first < low || last >= low + size || first > last) {
            throw new IndexFormatException(segment,
                    "key " + key + " holds blocks outside [" + low + ", " + (low + size) + ")");
        }
    }
}
