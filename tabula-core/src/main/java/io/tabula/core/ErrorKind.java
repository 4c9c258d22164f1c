package io.tabula.core;

/**
 * Classification of {@link TabulaException} failures.
 */
public enum ErrorKind {
    /** Value, index or column counts disagree (construction, insert, group setup, masks). */
    LENGTH_MISMATCH,
    /** A label is absent from an index lookup. */
    UNKNOWN_LABEL,
    /** A label that must resolve to one position matches several. */
    AMBIGUOUS_LABEL,
    /** A position is negative or not below the sequence length. */
    OUT_OF_BOUNDS,
    /** Row-wise append of tables whose column labels differ. */
    COLUMNS_DIFFER,
    /** Column-wise concat or element-wise arithmetic over differing row indexes. */
    INDEX_DIFFER,
    /** Lookup of a group key that does not exist. */
    GROUP_NOT_FOUND,
    /** Columns of different dtypes combined, or a numeric operation on non-numeric data. */
    DTYPE_MISMATCH,
    /** Column labels collide while {@link ColumnCollisionPolicy#REJECT} is in effect. */
    COLUMN_COLLISION
}
