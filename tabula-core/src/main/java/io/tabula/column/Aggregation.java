package io.tabula.column;

import java.util.NoSuchElementException;

/**
 * Reducers applied to a whole column.
 * <p>
 * {@link #COUNT} accepts any column. The others require a {@link NumericColumn} and fail with
 * {@code DTYPE_MISMATCH} otherwise. {@link #SUM}, {@link #MIN} and {@link #MAX} keep the
 * column's dtype; {@link #COUNT} yields {@code Long}; the rest yield {@code Double}.
 */
public enum Aggregation {
    SUM {
        @Override
        Object reduce(Column input) {
            NumericColumn column = requireNumeric(input);
            if (column instanceof LongColumn longs) {
                long sum = 0L;
                for (int i = 0; i < longs.size(); i++) {
                    sum += longs.getLong(i);
                }
                return sum;
            }
            double sum = 0.0;
            for (int i = 0; i < column.size(); i++) {
                sum += column.getDouble(i);
            }
            return sum;
        }
    },
    COUNT {
        @Override
        Object reduce(Column column) {
            return (long) column.size();
        }
    },
    MEAN {
        @Override
        Object reduce(Column column) {
            return mean(requireNumeric(column));
        }
    },
    /** Population variance: mean of squared deviations from the mean. */
    VAR {
        @Override
        Object reduce(Column column) {
            return squaredDeviations(requireNumeric(column)) / column.size();
        }
    },
    /** Sample variance with Bessel's correction ({@code n - 1}). */
    UNBIASED_VAR {
        @Override
        Object reduce(Column column) {
            return squaredDeviations(requireNumeric(column)) / (column.size() - 1);
        }
    },
    STD {
        @Override
        Object reduce(Column column) {
            return Math.sqrt(squaredDeviations(requireNumeric(column)) / column.size());
        }
    },
    UNBIASED_STD {
        @Override
        Object reduce(Column column) {
            return Math.sqrt(squaredDeviations(requireNumeric(column)) / (column.size() - 1));
        }
    },
    MIN {
        @Override
        Object reduce(Column input) {
            NumericColumn column = requireNumeric(input);
            requireNonEmpty(column, this);
            if (column instanceof LongColumn longs) {
                long min = longs.getLong(0);
                for (int i = 1; i < longs.size(); i++) {
                    min = Math.min(min, longs.getLong(i));
                }
                return min;
            }
            double min = column.getDouble(0);
            for (int i = 1; i < column.size(); i++) {
                min = Math.min(min, column.getDouble(i));
            }
            return min;
        }
    },
    MAX {
        @Override
        Object reduce(Column input) {
            NumericColumn column = requireNumeric(input);
            requireNonEmpty(column, this);
            if (column instanceof LongColumn longs) {
                long max = longs.getLong(0);
                for (int i = 1; i < longs.size(); i++) {
                    max = Math.max(max, longs.getLong(i));
                }
                return max;
            }
            double max = column.getDouble(0);
            for (int i = 1; i < column.size(); i++) {
                max = Math.max(max, column.getDouble(i));
            }
            return max;
        }
    };

    abstract Object reduce(Column column);

    /**
     * Reduce {@code column} to a single boxed value.
     */
    public Object apply(Column column) {
        if (column == null) {
            throw new IllegalArgumentException("column required");
        }
        return reduce(column);
    }

    /**
     * Dtype of the value produced for an input column of {@code input} dtype.
     */
    public DType resultType(DType input) {
        return switch (this) {
            case SUM, MIN, MAX -> input;
            case COUNT -> DType.LONG;
            default -> DType.DOUBLE;
        };
    }

    static double mean(NumericColumn column) {
        double sum = 0.0;
        for (int i = 0; i < column.size(); i++) {
            sum += column.getDouble(i);
        }
        return sum / column.size();
    }

    static double squaredDeviations(NumericColumn column) {
        double mean = mean(column);
        double sum = 0.0;
        for (int i = 0; i < column.size(); i++) {
            double deviation = column.getDouble(i) - mean;
            sum += deviation * deviation;
        }
        return sum;
    }

    private static NumericColumn requireNumeric(Column column) {
        if (!(column instanceof NumericColumn numeric)) {
            throw Columns.dtypeMismatch(DType.DOUBLE, column.dtype());
        }
        return numeric;
    }

    private static void requireNonEmpty(Column column, Aggregation aggregation) {
        if (column.size() == 0) {
            throw new NoSuchElementException(aggregation.name() + " of empty column");
        }
    }
}
