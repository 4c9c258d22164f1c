package io.tabula.column;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Primitive {@code double} column. Equality is bitwise per element, so {@code NaN} equals {@code NaN}.
 */
public final class DoubleColumn implements NumericColumn {
    private final double[] values;

    DoubleColumn(double[] values) {
        this.values = values;
    }

    public static DoubleColumn of(double... values) {
        if (values == null) {
            throw new IllegalArgumentException("values required");
        }
        return new DoubleColumn(values.clone());
    }

    @Override
    public int size() {
        return values.length;
    }

    @Override
    public DType dtype() {
        return DType.DOUBLE;
    }

    @Override
    public double getDouble(int position) {
        Columns.checkPosition(position, values.length);
        return values[position];
    }

    @Override
    public Double get(int position) {
        return getDouble(position);
    }

    @Override
    public DoubleColumn gatherUnchecked(int[] positions) {
        double[] gathered = new double[positions.length];
        for (int i = 0; i < positions.length; i++) {
            gathered[i] = values[positions[i]];
        }
        return new DoubleColumn(gathered);
    }

    @Override
    public DoubleColumn append(Column other) {
        DoubleColumn that = Columns.requireSameType(this, other, DoubleColumn.class);
        double[] combined = Arrays.copyOf(values, values.length + that.values.length);
        System.arraycopy(that.values, 0, combined, values.length, that.values.length);
        return new DoubleColumn(combined);
    }

    @Override
    public DoubleColumn copy() {
        return new DoubleColumn(values.clone());
    }

    public double[] toDoubleArray() {
        return values.clone();
    }

    @Override
    public List<Object> toList() {
        List<Object> list = new ArrayList<>(values.length);
        for (double value : values) {
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
        return Arrays.equals(values, ((DoubleColumn) obj).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "DoubleColumn" + Arrays.toString(values);
    }
}
