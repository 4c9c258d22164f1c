package io.tabula.column;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Primitive {@code long} column.
 */
public final class LongColumn implements NumericColumn {
    private final long[] values;

    LongColumn(long[] values) {
        this.values = values;
    }

    public static LongColumn of(long... values) {
        if (values == null) {
            throw new IllegalArgumentException("values required");
        }
        return new LongColumn(values.clone());
    }

    @Override
    public int size() {
        return values.length;
    }

    @Override
    public DType dtype() {
        return DType.LONG;
    }

    public long getLong(int position) {
        Columns.checkPosition(position, values.length);
        return values[position];
    }

    @Override
    public double getDouble(int position) {
        return getLong(position);
    }

    @Override
    public Long get(int position) {
        return getLong(position);
    }

    @Override
    public LongColumn gatherUnchecked(int[] positions) {
        long[] gathered = new long[positions.length];
        for (int i = 0; i < positions.length; i++) {
            gathered[i] = values[positions[i]];
        }
        return new LongColumn(gathered);
    }

    @Override
    public LongColumn append(Column other) {
        LongColumn that = Columns.requireSameType(this, other, LongColumn.class);
        long[] combined = Arrays.copyOf(values, values.length + that.values.length);
        System.arraycopy(that.values, 0, combined, values.length, that.values.length);
        return new LongColumn(combined);
    }

    @Override
    public LongColumn copy() {
        return new LongColumn(values.clone());
    }

    public long[] toLongArray() {
        return values.clone();
    }

    @Override
    public List<Object> toList() {
        List<Object> list = new ArrayList<>(values.length);
        for (long value : values) {
            list.add(value);
        }
        return list;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return Arrays.equals(values, ((LongColumn) obj).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "LongColumn" + Arrays.toString(values);
    }
}
