// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.model;

import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.sift.core.types.Address;
import sh.sift.core.types.Hash;
import sh.sift.core.types.HexData;
import sh.sift.core.types.Wei;

/**
 * A transaction of a block together with its execution: receipt and call tree.
 *
 * @param hash                 transaction hash
 * @param from                 sender
 * @param to                   recipient, {@code null} for contract creation
 * @param nonce                sender nonce
 * @param gasPrice             effective gas price
 * @param gasLimit             gas limit
 * @param value                wei transferred
 * @param input                transaction input
 * @param v                    signature V
 * @param r                    signature R
 * @param s                    signature S
 * @param gasUsed              gas used
 * @param type                 EIP-2718 transaction type
 * @param accessList           EIP-2930 access list
 * @param maxFeePerGas         EIP-1559 fee cap, {@code null} for earlier types
 * @param maxPriorityFeePerGas EIP-1559 tip cap, {@code null} for earlier types
 * @param index                position in the block
 * @param status               execution outcome
 * @param receipt              execution receipt with the transaction's logs
 * @param calls                call tree in pre-order (see {@link Call})
 * @param beginOrdinal         execution ordinal at start
 * @param endOrdinal           execution ordinal at end
 */
public record TransactionTrace(
        Hash hash,
        Address from,
        @Nullable Address to,
        long nonce,
        Wei gasPrice,
        long gasLimit,
        Wei value,
        HexData input,
        HexData v,
        HexData r,
        HexData s,
        long gasUsed,
        int type,
        List<AccessTuple> accessList,
        @Nullable Wei maxFeePerGas,
        @Nullable Wei maxPriorityFeePerGas,
        int index,
        TransactionStatus status,
        TransactionReceipt receipt,
        List<Call> calls,
        long beginOrdinal,
        long endOrdinal) {

    public TransactionTrace {
        Objects.requireNonNull(hash, "hash cannot be null");
        Objects.requireNonNull(from, "from cannot be null");
        Objects.requireNonNull(gasPrice, "gasPrice cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(input, "input cannot be null");
        Objects.requireNonNull(v, "v cannot be null");
        Objects.requireNonNull(r, "r cannot be null");
        Objects.requireNonNull(s, "s cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(receipt, "receipt cannot be null");
        accessList = List.copyOf(accessList);
        calls = List.copyOf(calls);
    }

    /**
     * Checks the pre-order precondition of the call tree: every non-root call names a
     * parent that appears earlier in {@link #calls()}.
     *
     * @return {@code true} if the call list is a valid pre-order listing
     */
    public boolean hasPreOrderCalls() {
        for (int i = 0; i < calls.size(); i++) {
            final Call call = calls.get(i);
            if (call.parentIndex() == 0) {
                continue;
            }
            if (call.parentIndex() >= call.index()) {
                return false;
            }
        }
        return true;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link TransactionTrace}. Collections default to empty, amounts to
     * zero, the receipt to {@link TransactionReceipt#EMPTY}.
     */
    public static final class Builder {
        private Hash hash;
        private Address from = Address.ZERO;
        private Address to;
        private long nonce;
        private Wei gasPrice = Wei.ZERO;
        private long gasLimit;
        private Wei value = Wei.ZERO;
        private HexData input = HexData.EMPTY;
        private HexData v = HexData.EMPTY;
        private HexData r = HexData.EMPTY;
        private HexData s = HexData.EMPTY;
        private long gasUsed;
        private int type;
        private List<AccessTuple> accessList = List.of();
        private Wei maxFeePerGas;
        private Wei maxPriorityFeePerGas;
        private int index;
        private TransactionStatus status = TransactionStatus.SUCCEEDED;
        private TransactionReceipt receipt = TransactionReceipt.EMPTY;
        private List<Call> calls = List.of();
        private long beginOrdinal;
        private long endOrdinal;

        private Builder() {}

        public Builder hash(final Hash hash) {
            this.hash = hash;
            return this;
        }

        public Builder from(final Address from) {
            this.from = from;
            return this;
        }

        public Builder to(final Address to) {
            this.to = to;
            return this;
        }

        public Builder nonce(final long nonce) {
            this.nonce = nonce;
            return this;
        }

        public Builder gasPrice(final Wei gasPrice) {
            this.gasPrice = gasPrice;
            return this;
        }

        public Builder gasLimit(final long gasLimit) {
            this.gasLimit = gasLimit;
            return this;
        }

        public Builder value(final Wei value) {
            this.value = value;
            return this;
        }

        public Builder input(final HexData input) {
            this.input = input;
            return this;
        }

        public Builder signature(final HexData v, final HexData r, final HexData s) {
            this.v = v;
            this.r = r;
            this.s = s;
            return this;
        }

        public Builder gasUsed(final long gasUsed) {
            this.gasUsed = gasUsed;
            return this;
        }

        public Builder type(final int type) {
            this.type = type;
            return this;
        }

        public Builder accessList(final List<AccessTuple> accessList) {
            this.accessList = accessList;
            return this;
        }

        public Builder maxFeePerGas(final Wei maxFeePerGas) {
            this.maxFeePerGas = maxFeePerGas;
            return this;
        }

        public Builder maxPriorityFeePerGas(final Wei maxPriorityFeePerGas) {
            this.maxPriorityFeePerGas = maxPriorityFeePerGas;
            return this;
        }

        public Builder index(final int index) {
            this.index = index;
            return this;
        }

        public Builder status(final TransactionStatus status) {
            this.status = status;
            return this;
        }

        public Builder receipt(final TransactionReceipt receipt) {
            this.receipt = receipt;
            return this;
        }

        public Builder calls(final List<Call> calls) {
            this.calls = calls;
            return this;
        }

        public Builder beginOrdinal(final long beginOrdinal) {
            this.beginOrdinal = beginOrdinal;
            return this;
        }

        public Builder endOrdinal(final long endOrdinal) {
            this.endOrdinal = endOrdinal;
            return this;
        }

        public TransactionTrace build() {
            return new TransactionTrace(
                    hash,
                    from,
                    to,
                    nonce,
                    gasPrice,
                    gasLimit,
                    value,
                    input,
                    v,
                    r,
                    s,
                    gasUsed,
                    type,
                    accessList,
                    maxFeePerGas,
                    maxPriorityFeePerGas,
                    index,
                    status,
                    receipt,
                    calls,
                    beginOrdinal,
                    endOrdinal);
        }
    }
}
