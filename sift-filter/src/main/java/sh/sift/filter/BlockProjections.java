// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.filter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import sh.sift.core.model.Block;
import sh.sift.core.model.Call;
import sh.sift.core.model.TransactionStatus;
import sh.sift.core.model.TransactionTrace;

/**
 * Reduced views of a block. Both projections are pure and total.
 */
public final class BlockProjections {

    /** {@link #headerOnly(Block)} as a transform. */
    public static final BlockTransform HEADER_ONLY = block -> Optional.of(headerOnly(block));

    /** {@link #callOnly(Block)} as a transform. */
    public static final BlockTransform CALL_ONLY = block -> Optional.of(callOnly(block));

    private BlockProjections() {
    }

    /**
     * Keeps hash, number, size and header. Uncles, traces, balance changes and code
     * changes become empty lists.
     */
    public static Block headerOnly(final Block block) {
        return new Block(
                block.ver(),
                block.hash(),
                block.number(),
                block.size(),
                block.header(),
                List.of(),
                List.of(),
                List.of(),
                List.of());
    }

    /**
     * Keeps what call-graph consumers read.
     *
     * <p>Per trace: hash, sender, recipient and receipt. Per call: position in the tree,
     * type, caller, address, value, gas, input, return data, execution flags and logs.
     * Status is reset to {@link TransactionStatus#UNKNOWN}; state changes and ordinals
     * are dropped. Block-level changes and uncles are dropped too.
     */
    public static Block callOnly(final Block block) {
        final List<TransactionTrace> traces = new ArrayList<>(block.transactionTraces().size());
        for (TransactionTrace trace : block.transactionTraces()) {
            traces.add(TransactionTrace.builder()
                    .hash(trace.hash())
                    .from(trace.from())
                    .to(trace.to())
                    .status(TransactionStatus.UNKNOWN)
                    .receipt(trace.receipt())
                    .calls(reducedCalls(trace.calls()))
                    .build());
        }
        return new Block(
                block.ver(),
                block.hash(),
                block.number(),
                block.size(),
                block.header(),
                List.of(),
                traces,
                List.of(),
                List.of());
    }

    private static List<Call> reducedCalls(final List<Call> calls) {
        final List<Call> reduced = new ArrayList<>(calls.size());
        for (Call call : calls) {
            reduced.add(Call.builder()
                    .index(call.index())
                    .parentIndex(call.parentIndex())
                    .depth(call.depth())
                    .callType(call.callType())
                    .caller(call.caller())
                    .address(call.address())
                    .value(call.value())
                    .gasLimit(call.gasLimit())
                    .gasConsumed(call.gasConsumed())
                    .returnData(call.returnData())
                    .input(call.input())
                    .executedCode(call.executedCode())
                    .suicide(call.suicide())
                    .logs(call.logs())
                    .build());
        }
        return reduced;
    }
}
