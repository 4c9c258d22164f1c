package io.tabula.kernel;

import java.util.Arrays;
import java.util.NoSuchElementException;

/**
 * Growable list of row positions. Backs every label and group bucket.
 */
public final class IntSelection {
    private static final int DEFAULT_CAPACITY = 4;

    private int[] values;
    private int size;

    public IntSelection() {
        this.values = new int[DEFAULT_CAPACITY];
    }

    public IntSelection(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity must be non-negative");
        }
        this.values = new int[Math.max(DEFAULT_CAPACITY, initialCapacity)];
    }

    public static IntSelection of(int... positions) {
        IntSelection selection = new IntSelection(positions.length);
        for (int position : positions) {
            selection.add(position);
        }
        return selection;
    }

    public void add(int position) {
        if (position < 0) {
            throw new IllegalArgumentException("position must be non-negative");
        }
        ensureCapacity(size + 1);
        values[size++] = position;
    }

    public int size() {
        return size;
    }

    public int get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("index out of range: " + index);
        }
        return values[index];
    }

    public int[] toIntArray() {
        return Arrays.copyOf(values, size);
    }

    public IntEnumerator enumerator() {
        return new IntEnumerator() {
            private int index;

            @Override
            public boolean hasNext() {
                return index < size;
            }

            @Override
            public int nextInt() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return values[index++];
            }
        };
    }

    public IntSelection copy() {
        IntSelection copy = new IntSelection(size);
        System.arraycopy(values, 0, copy.values, 0, size);
        copy.size = size;
        return copy;
    }

    @Override
    public String toString() {
        return "IntSelection" + Arrays.toString(toIntArray());
    }

    private void ensureCapacity(int desired) {
        if (desired <= values.length) {
            return;
        }
        int newCapacity = Math.max(values.length * 2, desired);
        values = Arrays.copyOf(values, newCapacity);
    }
}
