// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.index;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import sh.sift.core.model.Block;
import sh.sift.core.model.Call;
import sh.sift.core.model.LogEntry;
import sh.sift.core.model.TransactionTrace;
import sh.sift.core.types.Hash;

/**
 * Derives the searchable keys of a block for one {@link IndexKind}.
 *
 * <p>
 * <ul>
 * <li>per log: its address, and {@code topics[0]} when present</li>
 * <li>per call: its address, and its 4-byte method selector when the input is long enough</li>
 * </ul>
 * Whether keys carry an origin tag is decided by the kind, so the same extractor
 * serves legacy single-purpose segments and combined ones. Blocks are only read.
 */
public final class KeyExtractor {

    private final IndexKind kind;

    public KeyExtractor(final IndexKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public IndexKind kind() {
        return kind;
    }

    /**
     * @param block a decoded block
     * @return the distinct keys of the block, in first-seen order
     */
    public Set<String> extract(final Block block) {
        final Set<String> keys = new LinkedHashSet<>();
        for (TransactionTrace trace : block.transactionTraces()) {
            if (kind.covers(KeyOrigin.CALL)) {
                addCallKeys(trace, keys);
            }
            if (kind.covers(KeyOrigin.LOG)) {
                addLogKeys(trace, keys);
            }
        }
        return keys;
    }

    void addLogKeys(final TransactionTrace trace, final Set<String> out) {
        for (LogEntry log : trace.receipt().logs()) {
            out.add(kind.key(KeyOrigin.LOG, log.address().keyHex()));
            final Hash signature = log.eventSignature();
            if (signature != null) {
                out.add(kind.key(KeyOrigin.LOG, signature.keyHex()));
            }
        }
    }

    void addCallKeys(final TransactionTrace trace, final Set<String> out) {
        for (Call call : trace.calls()) {
            out.add(kind.key(KeyOrigin.CALL, call.address().keyHex()));
            final String method = call.methodKeyHex();
            if (method != null) {
                out.add(kind.key(KeyOrigin.CALL, method));
            }
        }
    }
}
