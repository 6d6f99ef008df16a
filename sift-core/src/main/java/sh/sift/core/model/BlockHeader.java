// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.model;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.sift.core.types.Address;
import sh.sift.core.types.Hash;
import sh.sift.core.types.HexData;
import sh.sift.core.types.Wei;

/**
 * Consensus header of a block.
 *
 * @param hash          the block hash
 * @param parentHash    the hash of the parent block
 * @param coinbase      the fee recipient
 * @param stateRoot     state trie root
 * @param receiptRoot   receipt trie root
 * @param logsBloom     bloom filter over every log of the block
 * @param number        the block number
 * @param gasLimit      gas limit of the block
 * @param gasUsed       gas used by the block
 * @param timestamp     block timestamp, seconds since epoch
 * @param extraData     free-form extra data
 * @param baseFeePerGas EIP-1559 base fee, {@code null} before London
 */
public record BlockHeader(
        Hash hash,
        Hash parentHash,
        Address coinbase,
        Hash stateRoot,
        Hash receiptRoot,
        HexData logsBloom,
        long number,
        long gasLimit,
        long gasUsed,
        long timestamp,
        HexData extraData,
        @Nullable Wei baseFeePerGas) {

    public BlockHeader {
        Objects.requireNonNull(hash, "hash cannot be null");
        Objects.requireNonNull(parentHash, "parentHash cannot be null");
        Objects.requireNonNull(coinbase, "coinbase cannot be null");
        Objects.requireNonNull(stateRoot, "stateRoot cannot be null");
        Objects.requireNonNull(receiptRoot, "receiptRoot cannot be null");
        Objects.requireNonNull(logsBloom, "logsBloom cannot be null");
        Objects.requireNonNull(extraData, "extraData cannot be null");
    }
}
