package io.tabula.kernel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partition of row positions by key.
 * <p>
 * Built once from a key sequence aligned 1:1 with the source rows. Every position lands in
 * exactly one bucket, and each bucket keeps its positions in row order.
 */
public final class HashGrouper<K> {
    private final Map<K, IntSelection> buckets;
    private final int rowCount;

    private HashGrouper(Map<K, IntSelection> buckets, int rowCount) {
        this.buckets = buckets;
        this.rowCount = rowCount;
    }

    public static <K> HashGrouper<K> build(List<? extends K> keys) {
        if (keys == null) {
            throw new IllegalArgumentException("keys required");
        }
        Map<K, IntSelection> buckets = new LinkedHashMap<>();
        int row = 0;
        for (K key : keys) {
            if (key == null) {
                throw new IllegalArgumentException("group key required at row " + row);
            }
            buckets.computeIfAbsent(key, k -> new IntSelection()).add(row);
            row++;
        }
        return new HashGrouper<>(buckets, row);
    }

    /**
     * Positions of the rows carrying {@code key} in row order, or {@code null} when the key is
     * absent. The array is a copy.
     */
    public int[] positions(K key) {
        IntSelection bucket = key == null ? null : buckets.get(key);
        return bucket == null ? null : bucket.toIntArray();
    }

    /**
     * Number of rows carrying {@code key}; zero when the key is absent.
     */
    public int count(K key) {
        IntSelection bucket = key == null ? null : buckets.get(key);
        return bucket == null ? 0 : bucket.size();
    }

    /**
     * Distinct keys sorted by {@code order}.
     */
    public List<K> sortedKeys(Comparator<? super K> order) {
        if (order == null) {
            throw new IllegalArgumentException("order required");
        }
        List<K> keys = new ArrayList<>(buckets.keySet());
        keys.sort(order);
        return keys;
    }

    public int groupCount() {
        return buckets.size();
    }

    public int rowCount() {
        return rowCount;
    }
}
