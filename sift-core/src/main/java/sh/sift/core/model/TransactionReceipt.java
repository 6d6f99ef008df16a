// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.model;

import java.util.List;
import java.util.Objects;

import sh.sift.core.types.HexData;

/**
 * Execution receipt of a transaction trace.
 *
 * <p>{@code logs} holds every log of the transaction that was not state-reverted, in
 * block order. It is populated by the block source; this engine never rebuilds it
 * from the call tree.
 *
 * @param stateRoot         post-transaction state root (empty after Byzantium)
 * @param cumulativeGasUsed gas used by the block up to and including this transaction
 * @param logsBloom         the 256-byte bloom filter over the logs
 * @param logs              emitted logs, may be empty but never null
 */
public record TransactionReceipt(
        HexData stateRoot,
        long cumulativeGasUsed,
        HexData logsBloom,
        List<LogEntry> logs) {

    public static final TransactionReceipt EMPTY =
            new TransactionReceipt(HexData.EMPTY, 0, HexData.EMPTY, List.of());

    public TransactionReceipt {
        Objects.requireNonNull(stateRoot, "stateRoot cannot be null");
        Objects.requireNonNull(logsBloom, "logsBloom cannot be null");
        Objects.requireNonNull(logs, "logs cannot be null");
        logs = List.copyOf(logs);
    }
}
