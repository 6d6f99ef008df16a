// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.model;

/**
 * Final outcome of a transaction trace.
 */
public enum TransactionStatus {
    UNKNOWN,
    SUCCEEDED,
    FAILED,
    REVERTED
}
