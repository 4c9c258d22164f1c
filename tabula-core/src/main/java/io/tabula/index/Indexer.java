package io.tabula.index;

import io.tabula.core.DuplicateLabelPolicy;
import io.tabula.core.TabulaException;
import io.tabula.kernel.IntEnumerator;
import io.tabula.kernel.IntSelection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered label sequence with a hash lookup from label to position(s).
 * <p>
 * Labels may repeat; a repeated label maps to all of its positions in ascending order.
 * The lookup is rebuilt together with the sequence and is never exposed, so two indexers are
 * equal exactly when their label sequences are equal.
 * <p>
 * The only mutation is {@link #push(Object)}. Callers sharing an indexer between several
 * tables must {@link #copy()} it before pushing. Tables and series only hand out
 * {@link #readOnlyView() read-only views}, which reject {@code push}.
 */
public final class Indexer<L> {
    private final List<L> labels;
    private final Map<L, IntSelection> locations;
    private final boolean readOnly;

    public Indexer(List<? extends L> labels) {
        if (labels == null) {
            throw new IllegalArgumentException("labels required");
        }
        this.readOnly = false;
        this.labels = new ArrayList<>(labels.size());
        this.locations = new HashMap<>(Math.max(16, labels.size() * 2));
        for (L label : labels) {
            push(label);
        }
    }

    private Indexer(List<L> labels, Map<L, IntSelection> locations, boolean readOnly) {
        this.labels = labels;
        this.locations = locations;
        this.readOnly = readOnly;
    }

    @SafeVarargs
    public static <L> Indexer<L> of(L... labels) {
        return new Indexer<>(Arrays.asList(labels));
    }

    /**
     * Default row index {@code 0..size-1}.
     */
    public static Indexer<Integer> range(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be non-negative");
        }
        List<Integer> labels = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            labels.add(i);
        }
        return new Indexer<>(labels);
    }

    public int size() {
        return labels.size();
    }

    public boolean isEmpty() {
        return labels.isEmpty();
    }

    public L label(int position) {
        if (position < 0 || position >= labels.size()) {
            throw TabulaException.outOfBounds(position, labels.size());
        }
        return labels.get(position);
    }

    public List<L> labels() {
        return Collections.unmodifiableList(labels);
    }

    public boolean contains(L label) {
        return label != null && locations.containsKey(label);
    }

    public boolean isUnique() {
        return locations.size() == labels.size();
    }

    /**
     * Positions of {@code label}, ascending. The array is a copy.
     */
    public int[] positionsOf(L label) {
        return bucket(label).toIntArray();
    }

    /**
     * Single position of {@code label}; a duplicated label is ambiguous here whatever the policy.
     */
    public int getLoc(L label) {
        IntSelection positions = bucket(label);
        if (positions.size() > 1) {
            throw TabulaException.ambiguousLabel(label, positions.size());
        }
        return positions.get(0);
    }

    public int[] getLocs(List<? extends L> queryLabels) {
        return getLocs(queryLabels, DuplicateLabelPolicy.ALL);
    }

    /**
     * Resolves labels to positions in query order.
     *
     * @param queryLabels labels to resolve
     * @param policy how a label with several positions resolves
     * @return the concatenated positions
     */
    public int[] getLocs(List<? extends L> queryLabels, DuplicateLabelPolicy policy) {
        if (queryLabels == null) {
            throw new IllegalArgumentException("queryLabels required");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy required");
        }
        IntSelection result = new IntSelection(queryLabels.size());
        for (L label : queryLabels) {
            IntSelection positions = bucket(label);
            if (positions.size() == 1 || policy == DuplicateLabelPolicy.FIRST) {
                result.add(positions.get(0));
                continue;
            }
            if (policy == DuplicateLabelPolicy.REJECT) {
                throw TabulaException.ambiguousLabel(label, positions.size());
            }
            IntEnumerator e = positions.enumerator();
            while (e.hasNext()) {
                result.add(e.nextInt());
            }
        }
        return result.toIntArray();
    }

    /**
     * New indexer holding {@code labels[positions]} in the given order.
     */
    public Indexer<L> reindex(int[] positions) {
        if (positions == null) {
            throw new IllegalArgumentException("positions required");
        }
        List<L> selected = new ArrayList<>(positions.length);
        for (int position : positions) {
            if (position < 0 || position >= labels.size()) {
                throw TabulaException.outOfBounds(position, labels.size());
            }
            selected.add(labels.get(position));
        }
        return new Indexer<>(selected);
    }

    public Indexer<L> append(Indexer<? extends L> other) {
        if (other == null) {
            throw new IllegalArgumentException("other required");
        }
        List<L> combined = new ArrayList<>(labels.size() + other.size());
        combined.addAll(labels);
        combined.addAll(other.labels);
        return new Indexer<>(combined);
    }

    /**
     * Appends {@code label} in place.
     *
     * @throws IllegalStateException on a read-only view
     */
    public void push(L label) {
        if (readOnly) {
            throw new IllegalStateException("indexer is read-only; push to a copy()");
        }
        if (label == null) {
            throw new IllegalArgumentException("label required");
        }
        int position = labels.size();
        labels.add(label);
        locations.computeIfAbsent(label, k -> new IntSelection(1)).add(position);
    }

    /**
     * View over the same labels that rejects {@link #push(Object)}.
     */
    public Indexer<L> readOnlyView() {
        return readOnly ? this : new Indexer<>(labels, locations, true);
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    /**
     * Writable deep copy; copying a read-only view gives a writable indexer.
     */
    public Indexer<L> copy() {
        Map<L, IntSelection> copiedLocations = new HashMap<>(Math.max(16, locations.size() * 2));
        for (Map.Entry<L, IntSelection> entry : locations.entrySet()) {
            copiedLocations.put(entry.getKey(), entry.getValue().copy());
        }
        return new Indexer<>(new ArrayList<>(labels), copiedLocations, false);
    }

    private IntSelection bucket(L label) {
        IntSelection positions = label == null ? null : locations.get(label);
        if (positions == null) {
            throw TabulaException.unknownLabel(label);
        }
        return positions;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        Indexer<?> other = (Indexer<?>) obj;
        return labels.equals(other.labels);
    }

    @Override
    public int hashCode() {
        return labels.hashCode();
    }

    @Override
    public String toString() {
        return "Indexer" + labels;
    }
}
