package io.tabula.column;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class BooleanColumn implements Column {
    private final boolean[] values;

    BooleanColumn(boolean[] values) {
        this.values = values;
    }

    public static BooleanColumn of(boolean... values) {
        if (values == null) {
            throw new IllegalArgumentException("values required");
        }
        return new BooleanColumn(values.clone());
    }

    @Override
    public int size() {
        return values.length;
    }

    @Override
    public DType dtype() {
        return DType.BOOL;
    }

    public boolean getBoolean(int position) {
        Columns.checkPosition(position, values.length);
        return values[position];
    }

    @Override
    public Boolean get(int position) {
        return getBoolean(position);
    }

    @Override
    public BooleanColumn gatherUnchecked(int[] positions) {
        boolean[] gathered = new boolean[positions.length];
        for (int i = 0; i < positions.length; i++) {
            gathered[i] = values[positions[i]];
        }
        return new BooleanColumn(gathered);
    }

    @Override
    public BooleanColumn append(Column other) {
        BooleanColumn that = Columns.requireSameType(this, other, BooleanColumn.class);
        boolean[] combined = Arrays.copyOf(values, values.length + that.values.length);
        System.arraycopy(that.values, 0, combined, values.length, that.values.length);
        return new BooleanColumn(combined);
    }

    @Override
    public BooleanColumn copy() {
        return new BooleanColumn(values.clone());
    }

    public boolean[] toBooleanArray() {
        return values.clone();
    }

    @Override
    public List<Object> toList() {
        List<Object> list = new ArrayList<>(values.length);
        for (boolean value : values) {
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
        return Arrays.equals(values, ((BooleanColumn) obj).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "BooleanColumn" + Arrays.toString(values);
    }
}
