// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.model;

import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.sift.core.types.Address;
import sh.sift.core.types.Hash;
import sh.sift.core.types.HexData;

/**
 * An event log emitted during a call and collected into its transaction receipt.
 *
 * @param address    the address of the contract that emitted the log
 * @param topics     the indexed topics (may be empty; {@code topics[0]} is
 *                   conventionally the event signature)
 * @param data       the non-indexed log data (may be empty)
 * @param index      position of the log within its transaction receipt
 * @param blockIndex position of the log within the whole block
 * @param ordinal    execution ordinal, assigned upstream
 */
public record LogEntry(
        Address address,
        List<Hash> topics,
        HexData data,
        int index,
        int blockIndex,
        long ordinal) {

    public LogEntry {
        Objects.requireNonNull(address, "address cannot be null");
        Objects.requireNonNull(topics, "topics cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        topics = List.copyOf(topics);
    }

    /**
     * @return {@code topics[0]}, or {@code null} for an anonymous log without topics
     */
    public @Nullable Hash eventSignature() {
        return topics.isEmpty() ? null : topics.get(0);
    }
}
