// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.error;

/**
 * Thrown when a filter request or index configuration is rejected before any block
 * is processed: an empty clause, an empty clause list, unparseable hex, or an
 * invalid index size.
 *
 * @since 0.1.0
 */
public final class FilterConfigurationException extends SiftException {

    public FilterConfigurationException(final String message) {
        super(message);
    }

    public FilterConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
