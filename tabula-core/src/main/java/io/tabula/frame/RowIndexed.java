package io.tabula.frame;

/**
 * Row-labeled container that can be gathered by position. Implemented by {@link Series} and
 * {@link Table}; this is what {@link GroupBy} groups over.
 *
 * @param <S> the concrete container type returned by {@link #iloc(int[])}
 */
public interface RowIndexed<S> {

    /**
     * Number of rows.
     */
    int size();

    /**
     * Rows at {@code positions}, in that order; positions may repeat.
     *
     * @throws io.tabula.core.TabulaException with {@code OUT_OF_BOUNDS} for an invalid position
     */
    S iloc(int[] positions);
}
