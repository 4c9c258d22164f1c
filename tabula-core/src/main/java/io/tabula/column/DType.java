package io.tabula.column;

/**
 * Element type tag of a {@link Column}.
 */
public enum DType {
    LONG(true),
    DOUBLE(true),
    BOOL(false),
    STRING(false);

    private final boolean numeric;

    DType(boolean numeric) {
        this.numeric = numeric;
    }

    public boolean isNumeric() {
        return numeric;
    }
}
