package io.tabula.column;

/**
 * Column whose elements can be read as {@code double} for aggregation and arithmetic.
 */
public sealed interface NumericColumn extends Column permits LongColumn, DoubleColumn {

    double getDouble(int position);
}
