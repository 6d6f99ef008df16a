// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.index;

/**
 * Where an index key was taken from. In combined segments the origin is written as a
 * one-letter prefix so log and call keys never collide.
 */
public enum KeyOrigin {
    LOG("L"),
    CALL("C");

    private final String tag;

    KeyOrigin(final String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
