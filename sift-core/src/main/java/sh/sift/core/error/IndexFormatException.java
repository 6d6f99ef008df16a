// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.error;

/**
 * Thrown when a serialized bitmap segment cannot be decoded.
 *
 * <p>The segment is unusable as a whole; readers treat its range as if no index
 * existed there.
 *
 * @since 0.1.0
 */
public final class IndexFormatException extends SiftException {

    private final String segment;

    public IndexFormatException(final String segment, final String message) {
        this(segment, message, null);
    }

    public IndexFormatException(final String segment, final String message, final Throwable cause) {
        super(segment == null ? message : "[" + segment + "] " + message, cause);
        this.segment = segment;
    }

    /**
     * @return the segment file name, or {@code null} when decoding detached bytes
     */
    public String segment() {
        return segment;
    }
}
