// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core.model;

/**
 * EVM call opcode family that produced a {@link Call}.
 */
public enum CallType {
    UNSPECIFIED,
    CALL,
    CALLCODE,
    DELEGATE,
    STATIC,
    CREATE
}
