package io.tabula.kernel;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Hash equi-join over two label sequences.
 * <p>
 * The right side is the build side; the left side probes it in its original order. For each
 * left label every matching right position is emitted in right order, so duplicates on either
 * side produce the full cross product.
 */
public final class HashJoin<L> {
    private final Map<L, IntSelection> buildTable = new HashMap<>();
    private int buildRowCount;

    public void build(List<? extends L> rightLabels) {
        if (rightLabels == null) {
            throw new IllegalArgumentException("rightLabels required");
        }
        for (L label : rightLabels) {
            buildTable.computeIfAbsent(label, k -> new IntSelection()).add(buildRowCount);
            buildRowCount++;
        }
    }

    public JoinPairs<L> probe(List<? extends L> leftLabels) {
        if (leftLabels == null) {
            throw new IllegalArgumentException("leftLabels required");
        }
        List<L> labels = new ArrayList<>();
        IntSelection left = new IntSelection(leftLabels.size());
        IntSelection right = new IntSelection(leftLabels.size());
        int rowIdx = 0;
        for (L label : leftLabels) {
            IntSelection match = buildTable.get(label);
            if (match != null) {
                IntEnumerator me = match.enumerator();
                while (me.hasNext()) {
                    labels.add(label);
                    left.add(rowIdx);
                    right.add(me.nextInt());
                }
            }
            rowIdx++;
        }
        return new JoinPairs<>(labels, left.toIntArray(), right.toIntArray());
    }

    public static <L> JoinPairs<L> inner(List<? extends L> leftLabels, List<? extends L> rightLabels) {
        HashJoin<L> join = new HashJoin<>();
        join.build(rightLabels);
        return join.probe(leftLabels);
    }

    public int buildRowCount() {
        return buildRowCount;
    }

    public int distinctKeys() {
        return buildTable.size();
    }
}
