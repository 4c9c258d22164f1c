package io.tabula.column;

import java.util.List;

/**
 * Immutable typed array backing one table column or one series.
 * <p>
 * Columns never change after construction; every operation returns a new column. That makes
 * it safe for several tables to hold the same column instance.
 */
public sealed interface Column permits NumericColumn, BooleanColumn, StringColumn {

    int size();

    DType dtype();

    default boolean isNumeric() {
        return dtype().isNumeric();
    }

    /**
     * Boxed element at {@code position}.
     *
     * @throws io.tabula.core.TabulaException with {@code OUT_OF_BOUNDS} for an invalid position
     */
    Object get(int position);

    /**
     * New column holding the elements at {@code positions}, in that order. Positions may repeat.
     * <p>
     * Positions are not validated: callers must have checked them against {@link #size()}.
     */
    Column gatherUnchecked(int[] positions);

    /**
     * New column holding this column's elements followed by {@code other}'s.
     *
     * @throws io.tabula.core.TabulaException with {@code DTYPE_MISMATCH} when dtypes differ
     */
    Column append(Column other);

    Column copy();

    List<Object> toList();
}
