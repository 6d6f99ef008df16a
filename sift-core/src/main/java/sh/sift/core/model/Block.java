// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.model;

import java.util.List;
import java.util.Objects;

import sh.sift.core.types.Hash;

/**
 * A fully decoded block as delivered by the block source.
 *
 * <p>Immutable. Transforms never modify a block in place; they build a new one with
 * {@link #withTransactionTraces(List)} or the projections of the filter module.
 *
 * @param ver               payload version of the block model
 * @param hash              block hash
 * @param number            block number
 * @param size              encoded size in bytes
 * @param header            consensus header
 * @param uncles            uncle headers
 * @param transactionTraces executed transactions, in block order
 * @param balanceChanges    block-level balance changes (rewards, withdrawals)
 * @param codeChanges       block-level code changes
 */
public record Block(
        int ver,
        Hash hash,
        long number,
        long size,
        BlockHeader header,
        List<BlockHeader> uncles,
        List<TransactionTrace> transactionTraces,
        List<BalanceChange> balanceChanges,
        List<CodeChange> codeChanges) {

    public Block {
        Objects.requireNonNull(hash, "hash cannot be null");
        Objects.requireNonNull(header, "header cannot be null");
        if (number < 0) {
            throw new IllegalArgumentException("block number must be >= 0, got: " + number);
        }
        uncles = List.copyOf(uncles);
        transactionTraces = List.copyOf(transactionTraces);
        balanceChanges = List.copyOf(balanceChanges);
        codeChanges = List.copyOf(codeChanges);
    }

    /**
     * @param traces the traces the new block carries
     * @return a copy of this block with {@code traces} in place of its transaction traces
     */
    public Block withTransactionTraces(final List<TransactionTrace> traces) {
        return new Block(ver, hash, number, size, header, uncles, traces, balanceChanges, codeChanges);
    }
}
