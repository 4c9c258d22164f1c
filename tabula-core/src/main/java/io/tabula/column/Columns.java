package io.tabula.column;

import io.tabula.core.ErrorKind;
import io.tabula.core.TabulaException;

import java.util.List;

/**
 * Factories for building columns from boxed values.
 * <p>
 * Boxed values map to dtypes as follows: {@code Long}, {@code Integer}, {@code Short} and
 * {@code Byte} to {@link DType#LONG}; {@code Double} and {@code Float} to {@link DType#DOUBLE};
 * {@code Boolean} to {@link DType#BOOL}; {@code String} to {@link DType#STRING}.
 */
public final class Columns {

    private Columns() {
    }

    public static Column empty(DType dtype) {
        if (dtype == null) {
            throw new IllegalArgumentException("dtype required");
        }
        return switch (dtype) {
            case LONG -> new LongColumn(new long[0]);
            case DOUBLE -> new DoubleColumn(new double[0]);
            case BOOL -> new BooleanColumn(new boolean[0]);
            case STRING -> new StringColumn(new String[0]);
        };
    }

    /**
     * Column inferred from the first value's type.
     *
     * @throws IllegalArgumentException for an empty list, null elements or unsupported types
     */
    public static Column fromValues(List<?> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("values required");
        }
        return fromValues(values, dtypeOf(values.get(0)));
    }

    /**
     * Column of {@code dtype} holding {@code values}; an empty list gives an empty column.
     */
    public static Column fromValues(List<?> values, DType dtype) {
        if (values == null) {
            throw new IllegalArgumentException("values required");
        }
        if (dtype == null) {
            throw new IllegalArgumentException("dtype required");
        }
        int size = values.size();
        return switch (dtype) {
            case LONG -> {
                long[] longs = new long[size];
                for (int i = 0; i < size; i++) {
                    longs[i] = element(values, i, dtype, Number.class).longValue();
                }
                yield new LongColumn(longs);
            }
            case DOUBLE -> {
                double[] doubles = new double[size];
                for (int i = 0; i < size; i++) {
                    doubles[i] = element(values, i, dtype, Number.class).doubleValue();
                }
                yield new DoubleColumn(doubles);
            }
            case BOOL -> {
                boolean[] booleans = new boolean[size];
                for (int i = 0; i < size; i++) {
                    booleans[i] = element(values, i, dtype, Boolean.class);
                }
                yield new BooleanColumn(booleans);
            }
            case STRING -> {
                String[] strings = new String[size];
                for (int i = 0; i < size; i++) {
                    strings[i] = element(values, i, dtype, String.class);
                }
                yield new StringColumn(strings);
            }
        };
    }

    /**
     * Common dtype of {@code values}: their shared dtype, {@link DType#DOUBLE} when integral and
     * floating values mix, or {@code whenEmpty} for an empty list.
     *
     * @throws IllegalArgumentException when numeric and non-numeric values mix
     */
    public static DType inferDType(List<?> values, DType whenEmpty) {
        if (values == null) {
            throw new IllegalArgumentException("values required");
        }
        DType common = null;
        for (Object value : values) {
            DType dtype = dtypeOf(value);
            if (common == null || common == dtype) {
                common = dtype;
            } else if (common.isNumeric() && dtype.isNumeric()) {
                common = DType.DOUBLE;
            } else {
                throw new IllegalArgumentException("values mix " + common + " and " + dtype);
            }
        }
        return common == null ? whenEmpty : common;
    }

    public static DType dtypeOf(Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return DType.LONG;
        }
        if (value instanceof Double || value instanceof Float) {
            return DType.DOUBLE;
        }
        if (value instanceof Boolean) {
            return DType.BOOL;
        }
        if (value instanceof String) {
            return DType.STRING;
        }
        if (value == null) {
            throw new IllegalArgumentException("value required");
        }
        throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
    }

    static void checkPosition(int position, int size) {
        if (position < 0 || position >= size) {
            throw TabulaException.outOfBounds(position, size);
        }
    }

    static <C extends Column> C requireSameType(Column self, Column other, Class<C> type) {
        if (other == null) {
            throw new IllegalArgumentException("other required");
        }
        if (!type.isInstance(other)) {
            throw dtypeMismatch(self.dtype(), other.dtype());
        }
        return type.cast(other);
    }

    static TabulaException dtypeMismatch(DType expected, DType actual) {
        return new TabulaException(ErrorKind.DTYPE_MISMATCH,
                "dtype mismatch: expected " + expected + " but was " + actual);
    }

    private static <T> T element(List<?> values, int index, DType dtype, Class<T> type) {
        Object value = values.get(index);
        if (value == null) {
            throw new IllegalArgumentException("value required at position " + index);
        }
        // LONG accepts integral boxes only; DOUBLE widens any supported number
        if (!type.isInstance(value) || (dtype == DType.LONG && dtypeOf(value) != DType.LONG)) {
            throw new IllegalArgumentException("value at position " + index + " is not " + dtype + ": " + value);
        }
        return type.cast(value);
    }
}
