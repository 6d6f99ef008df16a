// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.index;

import java.util.Objects;

/**
 * Index families, each stored under its own shortname so segments of different kinds
 * never share a file name.
 *
 * <ul>
 * <li>{@link #LOG} - untagged log address and event signature keys</li>
 * <li>{@link #CALL} - untagged call address and method selector keys</li>
 * <li>{@link #COMBINED} - both, tagged with their {@link KeyOrigin}</li>
 * </ul>
 */
public enum IndexKind {
    LOG("logaddrsig", true, false, false),
    CALL("calladdrsig", false, true, false),
    COMBINED("combined", true, true, true);

    private final String shortname;
    private final boolean logs;
    private final boolean calls;
    private final boolean tagged;

    IndexKind(final String shortname, final boolean logs, final boolean calls, final boolean tagged) {
        this.shortname = shortname;
        this.logs = logs;
        this.calls = calls;
        this.tagged = tagged;
    }

    public String shortname() {
        return shortname;
    }

    public boolean isTagged() {
        return tagged;
    }

    /**
     * @param origin a key origin
     * @return whether segments of this kind hold keys from {@code origin}
     */
    public boolean covers(final KeyOrigin origin) {
        return origin == KeyOrigin.LOG ? logs : calls;
    }

    /**
     * Builds the segment key for a bare hex value.
     *
     * @param origin where the value comes from
     * @param keyHex lowercase hex without {@code 0x}
     * @return {@code keyHex}, prefixed with the origin tag for tagged kinds
     */
    public String key(final KeyOrigin origin, final String keyHex) {
        Objects.requireNonNull(keyHex, "keyHex");
        return tagged ? origin.tag() + keyHex : keyHex;
    }

    public static IndexKind fromShortname(final String shortname) {
        for (IndexKind kind : values()) {
            if (kind.shortname.equals(shortname)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown index kind: " + shortname);
    }
}
