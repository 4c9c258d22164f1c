package io.tabula.core;

/**
 * How a label lookup resolves a label that occurs at several positions.
 */
public enum DuplicateLabelPolicy {
    /** Every matching position, ascending. */
    ALL,
    /** Only the first matching position. */
    FIRST,
    /** Fail with {@link ErrorKind#AMBIGUOUS_LABEL}. */
    REJECT
}
