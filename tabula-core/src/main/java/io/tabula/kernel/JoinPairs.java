package io.tabula.kernel;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Result of a hash join: the i-th matched pair joins left row {@code leftPositions[i]} with right
 * row {@code rightPositions[i]}, both carrying {@code labels.get(i)}.
 * <p>
 * Position arrays are copied in and out; equality compares their contents.
 */
public record JoinPairs<L>(List<L> labels, int[] leftPositions, int[] rightPositions) {
    public JoinPairs {
        if (labels == null || leftPositions == null || rightPositions == null) {
            throw new IllegalArgumentException("labels and positions required");
        }
        if (labels.size() != leftPositions.length || labels.size() != rightPositions.length) {
            throw new IllegalArgumentException("labels and positions must have equal length");
        }
        labels = List.copyOf(labels);
        leftPositions = leftPositions.clone();
        rightPositions = rightPositions.clone();
    }

    @Override
    public int[] leftPositions() {
        return leftPositions.clone();
    }

    @Override
    public int[] rightPositions() {
        return rightPositions.clone();
    }

    public int size() {
        return labels.size();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof JoinPairs<?> other)) {
            return false;
        }
        return labels.equals(other.labels)
                && Arrays.equals(leftPositions, other.leftPositions)
                && Arrays.equals(rightPositions, other.rightPositions);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(labels);
        result = 31 * result + Arrays.hashCode(leftPositions);
        return 31 * result + Arrays.hashCode(rightPositions);
    }

    @Override
    public String toString() {
        return "JoinPairs[labels=" + labels + ", leftPositions=" + Arrays.toString(leftPositions)
                + ", rightPositions=" + Arrays.toString(rightPositions) + "]";
    }
}
