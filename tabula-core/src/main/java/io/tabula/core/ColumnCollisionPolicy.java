package io.tabula.core;

/**
 * How joins and column-wise concatenation treat column labels present on both sides.
 */
public enum ColumnCollisionPolicy {
    /** Keep both columns under the same label; lookups of that label see both. */
    KEEP,
    /** Fail with {@link ErrorKind#COLUMN_COLLISION}. */
    REJECT
}
