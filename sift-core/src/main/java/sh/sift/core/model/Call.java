// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.model;

import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.sift.core.types.Address;
import sh.sift.core.types.HexData;
import sh.sift.core.types.Signature;
import sh.sift.core.types.Wei;

/**
 * One frame of a transaction's call tree.
 *
 * <p>
 * <strong>Preconditions</strong> (established by the block source, not re-derived here):
 * <ul>
 * <li>calls of a trace are listed in pre-order, so a parent always precedes its
 * children and {@code parentIndex < index} for every non-root call</li>
 * <li>{@code stateReverted} is already propagated from reverted ancestors</li>
 * <li>log and change ordinals are already assigned</li>
 * </ul>
 *
 * @param index          1-based position of the call in its trace
 * @param parentIndex    index of the parent call, {@code 0} for the root
 * @param depth          nesting depth, {@code 0} for the root
 * @param callType       opcode family
 * @param caller         the calling account
 * @param address        the called account (or created contract)
 * @param value          wei transferred
 * @param gasLimit       gas made available to the call
 * @param gasConsumed    gas used by the call
 * @param returnData     returned bytes
 * @param input          call data; its first 4 bytes are the method selector
 * @param executedCode   whether code ran at {@code address}
 * @param suicide        whether the call self-destructed
 * @param logs           logs emitted by this call frame
 * @param storageChanges storage writes of this frame
 * @param balanceChanges balance changes of this frame
 * @param codeChanges    code changes of this frame
 * @param statusFailed   whether the frame failed
 * @param statusReverted whether the frame reverted
 * @param stateReverted  whether the frame's effects were rolled back by itself or an ancestor
 * @param failureReason  upstream failure description, empty when none
 * @param beginOrdinal   execution ordinal at entry
 * @param endOrdinal     execution ordinal at exit
 */
public record Call(
        int index,
        int parentIndex,
        int depth,
        CallType callType,
        Address caller,
        Address address,
        Wei value,
        long gasLimit,
        long gasConsumed,
        HexData returnData,
        HexData input,
        boolean executedCode,
        boolean suicide,
        List<LogEntry> logs,
        List<StorageChange> storageChanges,
        List<BalanceChange> balanceChanges,
        List<CodeChange> codeChanges,
        boolean statusFailed,
        boolean statusReverted,
        boolean stateReverted,
        String failureReason,
        long beginOrdinal,
        long endOrdinal) {

    public Call {
        Objects.requireNonNull(callType, "callType cannot be null");
        Objects.requireNonNull(caller, "caller cannot be null");
        Objects.requireNonNull(address, "address cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(returnData, "returnData cannot be null");
        Objects.requireNonNull(input, "input cannot be null");
        Objects.requireNonNull(failureReason, "failureReason cannot be null");
        logs = List.copyOf(logs);
        storageChanges = List.copyOf(storageChanges);
        balanceChanges = List.copyOf(balanceChanges);
        codeChanges = List.copyOf(codeChanges);
    }

    /**
     * @return the 4-byte method selector, or {@code null} if the input is shorter
     */
    public @Nullable Signature method() {
        final String selector = methodKeyHex();
        return selector == null ? null : new Signature("0x" + selector);
    }

    /**
     * @return the method selector as bare hex, or {@code null} if the input is shorter
     */
    public @Nullable String methodKeyHex() {
        return input.leadingKeyHex(Signature.SELECTOR_LENGTH);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link Call}. Collections default to empty, amounts to zero,
     * payloads to {@link HexData#EMPTY}.
     */
    public static final class Builder {
        private int index;
        private int parentIndex;
        private int depth;
        private CallType callType = CallType.CALL;
        private Address caller = Address.ZERO;
        private Address address = Address.ZERO;
        private Wei value = Wei.ZERO;
        private long gasLimit;
        private long gasConsumed;
        private HexData returnData = HexData.EMPTY;
        private HexData input = HexData.EMPTY;
        private boolean executedCode;
        private boolean suicide;
        private List<LogEntry> logs = List.of();
        private List<StorageChange> storageChanges = List.of();
        private List<BalanceChange> balanceChanges = List.of();
        private List<CodeChange> codeChanges = List.of();
        private boolean statusFailed;
        private boolean statusReverted;
        private boolean stateReverted;
        private String failureReason = "";
        private long beginOrdinal;
        private long endOrdinal;

        private Builder() {}

        public Builder index(final int index) {
            this.index = index;
            return this;
        }

        public Builder parentIndex(final int parentIndex) {
            this.parentIndex = parentIndex;
            return this;
        }

        public Builder depth(final int depth) {
            this.depth = depth;
            return this;
        }

        public Builder callType(final CallType callType) {
            this.callType = callType;
            return this;
        }

        public Builder caller(final Address caller) {
            this.caller = caller;
            return this;
        }

        public Builder address(final Address address) {
            this.address = address;
            return this;
        }

        public Builder value(final Wei value) {
            this.value = value;
            return this;
        }

        public Builder gasLimit(final long gasLimit) {
            this.gasLimit = gasLimit;
            return this;
        }

        public Builder gasConsumed(final long gasConsumed) {
            this.gasConsumed = gasConsumed;
            return this;
        }

        public Builder returnData(final HexData returnData) {
            this.returnData = returnData;
            return this;
        }

        public Builder input(final HexData input) {
            this.input = input;
            return this;
        }

        public Builder executedCode(final boolean executedCode) {
            this.executedCode = executedCode;
            return this;
        }

        public Builder suicide(final boolean suicide) {
            this.suicide = suicide;
            return this;
        }

        public Builder logs(final List<LogEntry> logs) {
            this.logs = logs;
            return this;
        }

        public Builder storageChanges(final List<StorageChange> storageChanges) {
            this.storageChanges = storageChanges;
            return this;
        }

        public Builder balanceChanges(final List<BalanceChange> balanceChanges) {
            this.balanceChanges = balanceChanges;
            return this;
        }

        public Builder codeChanges(final List<CodeChange> codeChanges) {
            this.codeChanges = codeChanges;
            return this;
        }

        public Builder statusFailed(final boolean statusFailed) {
            this.statusFailed = statusFailed;
            return this;
        }

        public Builder statusReverted(final boolean statusReverted) {
            this.statusReverted = statusReverted;
            return this;
        }

        public Builder stateReverted(final boolean stateReverted) {
            this.stateReverted = stateReverted;
            return this;
        }

        public Builder failureReason(final String failureReason) {
            this.failureReason = failureReason;
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

        public Call build() {
            return new Call(
                    index,
                    parentIndex,
                    depth,
                    callType,
                    caller,
                    address,
                    value,
                    gasLimit,
                    gasConsumed,
                    returnData,
                    input,
                    executedCode,
                    suicide,
                    logs,
                    storageChanges,
                    balanceChanges,
                    codeChanges,
                    statusFailed,
                    statusReverted,
                    stateReverted,
                    failureReason,
                    beginOrdinal,
                    endOrdinal);
        }
    }
}
