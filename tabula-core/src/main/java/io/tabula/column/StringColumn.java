package io.tabula.column;

import java.util.Arrays;
import java.util.List;

public final class StringColumn implements Column {
    private final String[] values;

    StringColumn(String[] values) {
        this.values = values;
    }

    public static StringColumn of(String... values) {
        if (values == null) {
            throw new IllegalArgumentException("values required");
        }
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                throw new IllegalArgumentException("value required at position " + i);
            }
        }
        return new StringColumn(values.clone());
    }

    @Override
    public int size() {
        return values.length;
    }

    @Override
    public DType dtype() {
        return DType.STRING;
    }

    @Override
    public String get(int position) {
        Columns.checkPosition(position, values.length);
        return values[position];
    }

    @Override
    public StringColumn gatherUnchecked(int[] positions) {
        String[] gathered = new String[positions.length];
        for (int i = 0; i < positions.length; i++) {
            gathered[i] = values[positions[i]];
        }
        return new StringColumn(gathered);
    }

    @Override
    public StringColumn append(Column other) {
        StringColumn that = Columns.requireSameType(this, other, StringColumn.class);
        String[] combined = Arrays.copyOf(values, values.length + that.values.length);
        System.arraycopy(that.values, 0, combined, values.length, that.values.length);
        return new StringColumn(combined);
    }

    @Override
    public StringColumn copy() {
        return new StringColumn(values.clone());
    }

    @Override
    public List<Object> toList() {
        return List.of((Object[]) values);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return Arrays.equals(values, ((StringColumn) obj).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "StringColumn" + Arrays.toString(values);
    }
}
