package io.tabula.frame;

import io.tabula.column.Aggregation;
import io.tabula.column.ArithmeticOp;
import io.tabula.column.Column;
import io.tabula.column.Columns;
import io.tabula.column.DType;
import io.tabula.column.DoubleColumn;
import io.tabula.core.ErrorKind;
import io.tabula.core.TabulaConfiguration;
import io.tabula.core.TabulaException;
import io.tabula.index.Indexer;
import io.tabula.kernel.Cow;
import io.tabula.kernel.HashGrouper;
import io.tabula.kernel.IntSelection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * One labeled column: a row {@link Indexer} and a {@link Column} of the same size.
 * <p>
 * Series are immutable. Operations that keep the row labels share the index with the result
 * instead of copying it.
 *
 * @param <L> row label type
 */
public final class Series<L> implements RowIndexed<Series<L>> {
    private static final List<String> DESCRIBE_LABELS = List.of("count", "mean", "std", "min", "max");

    private final Cow<Indexer<L>> index;
    private final Column values;
    private final TabulaConfiguration configuration;

    Series(Cow<Indexer<L>> index, Column values, TabulaConfiguration configuration) {
        this.index = index;
        this.values = values;
        this.configuration = configuration;
    }

    /**
     * Series labeled {@code 0..size-1}.
     */
    public static Series<Integer> of(Column values) {
        if (values == null) {
            throw new IllegalArgumentException("values required");
        }
        return new Series<>(Cow.owned(Indexer.range(values.size())), values, TabulaConfiguration.defaults());
    }

    public static <L> Series<L> of(Column values, List<? extends L> index) {
        if (index == null) {
            throw new IllegalArgumentException("index required");
        }
        return create(values, new Indexer<L>(index), TabulaConfiguration.defaults());
    }

    public static <L> Series<L> of(Column values, Indexer<L> index, TabulaConfiguration configuration) {
        if (index == null) {
            throw new IllegalArgumentException("index required");
        }
        return create(values, index.copy(), configuration);
    }

    private static <L> Series<L> create(Column values, Indexer<L> index, TabulaConfiguration configuration) {
        if (values == null) {
            throw new IllegalArgumentException("values required");
        }
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        if (values.size() != index.size()) {
            throw TabulaException.lengthMismatch("values", index.size(), values.size());
        }
        return new Series<>(Cow.owned(index), values, configuration);
    }

    @Override
    public int size() {
        return values.size();
    }

    /**
     * Row labels, as a read-only view.
     */
    public Indexer<L> index() {
        return index.get().readOnlyView();
    }

    public Column values() {
        return values;
    }

    public DType dtype() {
        return values.dtype();
    }

    public TabulaConfiguration configuration() {
        return configuration;
    }

    /**
     * Value carried by {@code label}.
     *
     * @throws TabulaException {@code UNKNOWN_LABEL}, or {@code AMBIGUOUS_LABEL} for a duplicated label
     */
    public Object get(L label) {
        return values.get(index.get().getLoc(label));
    }

    public Object iget(int position) {
        return values.get(position);
    }

    public Series<L> loc(List<? extends L> labels) {
        return iloc(index.get().getLocs(labels, configuration.duplicateLabelPolicy()));
    }

    @Override
    public Series<L> iloc(int[] positions) {
        Indexer<L> newIndex = index.get().reindex(positions);
        // bounds are checked by reindex
        return new Series<>(Cow.owned(newIndex), values.gatherUnchecked(positions), configuration);
    }

    /**
     * Rows whose flag in {@code mask} is set.
     */
    public Series<L> filter(boolean[] mask) {
        return iloc(maskPositions(mask, size()));
    }

    public Series<L> append(Series<? extends L> other) {
        if (other == null) {
            throw new IllegalArgumentException("other required");
        }
        Column combined = values.append(other.values);
        return new Series<>(Cow.owned(index.get().append(other.index.get())), combined, configuration);
    }

    /**
     * Apply {@code function} to the whole column.
     */
    public <W> W apply(Function<? super Column, W> function) {
        if (function == null) {
            throw new IllegalArgumentException("function required");
        }
        return function.apply(values);
    }

    public Object aggregate(Aggregation aggregation) {
        if (aggregation == null) {
            throw new IllegalArgumentException("aggregation required");
        }
        return aggregation.apply(values);
    }

    public Number sum() {
        return (Number) aggregate(Aggregation.SUM);
    }

    public long count() {
        return (Long) aggregate(Aggregation.COUNT);
    }

    public double mean() {
        return (Double) aggregate(Aggregation.MEAN);
    }

    public double var() {
        return (Double) aggregate(Aggregation.VAR);
    }

    public double unbiasedVar() {
        return (Double) aggregate(Aggregation.UNBIASED_VAR);
    }

    public double std() {
        return (Double) aggregate(Aggregation.STD);
    }

    public double unbiasedStd() {
        return (Double) aggregate(Aggregation.UNBIASED_STD);
    }

    public Number min() {
        return (Number) aggregate(Aggregation.MIN);
    }

    public Number max() {
        return (Number) aggregate(Aggregation.MAX);
    }

    /**
     * Summary statistics labeled {@code count, mean, std, min, max}; {@code std} is the
     * population standard deviation.
     */
    public Series<String> describe() {
        DoubleColumn summary = DoubleColumn.of(
                count(),
                mean(),
                std(),
                min().doubleValue(),
                max().doubleValue());
        return new Series<>(Cow.owned(new Indexer<>(DESCRIBE_LABELS)), summary, configuration);
    }

    /**
     * Number of occurrences of each distinct value, labeled by the values in ascending order.
     */
    public Series<Object> valueCounts() {
        HashGrouper<Object> grouper = HashGrouper.build(values.toList());
        List<Object> distinct = grouper.sortedKeys(naturalOrder());
        List<Long> counts = new ArrayList<>(distinct.size());
        for (Object value : distinct) {
            counts.add((long) grouper.count(value));
        }
        return new Series<>(Cow.owned(new Indexer<>(distinct)), Columns.fromValues(counts, DType.LONG), configuration);
    }

    public Series<L> add(Number scalar) {
        return broadcast(ArithmeticOp.ADD, scalar);
    }

    public Series<L> add(Series<L> other) {
        return combine(ArithmeticOp.ADD, other);
    }

    public Series<L> sub(Number scalar) {
        return broadcast(ArithmeticOp.SUB, scalar);
    }

    public Series<L> sub(Series<L> other) {
        return combine(ArithmeticOp.SUB, other);
    }

    public Series<L> mul(Number scalar) {
        return broadcast(ArithmeticOp.MUL, scalar);
    }

    public Series<L> mul(Series<L> other) {
        return combine(ArithmeticOp.MUL, other);
    }

    public Series<L> div(Number scalar) {
        return broadcast(ArithmeticOp.DIV, scalar);
    }

    public Series<L> div(Series<L> other) {
        return combine(ArithmeticOp.DIV, other);
    }

    public Series<L> rem(Number scalar) {
        return broadcast(ArithmeticOp.REM, scalar);
    }

    public Series<L> rem(Series<L> other) {
        return combine(ArithmeticOp.REM, other);
    }

    /**
     * Group rows by {@code keys}, aligned 1:1 with this series' rows.
     */
    public <G extends Comparable<? super G>> SeriesGroupBy<L, G> groupBy(List<? extends G> keys) {
        return new SeriesGroupBy<>(this, keys);
    }

    Series<L> withValues(Column newValues) {
        return new Series<>(index.share(), newValues, configuration);
    }

    private Series<L> broadcast(ArithmeticOp op, Number scalar) {
        return withValues(op.broadcast(values, scalar));
    }

    private Series<L> combine(ArithmeticOp op, Series<L> other) {
        if (other == null) {
            throw new IllegalArgumentException("other required");
        }
        if (!index.get().equals(other.index.get())) {
            throw new TabulaException(ErrorKind.INDEX_DIFFER, "series indexes differ");
        }
        return withValues(op.apply(values, other.values));
    }

    static int[] maskPositions(boolean[] mask, int size) {
        if (mask == null) {
            throw new IllegalArgumentException("mask required");
        }
        if (mask.length != size) {
            throw TabulaException.lengthMismatch("mask", size, mask.length);
        }
        IntSelection positions = new IntSelection(size);
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) {
                positions.add(i);
            }
        }
        return positions.toIntArray();
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Comparator<Object> naturalOrder() {
        // all values of one column share a dtype, hence a single Comparable class
        return (left, right) -> ((Comparable) left).compareTo(right);
    }

    Cow<Indexer<L>> indexSlot() {
        return index;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        Series<?> other = (Series<?>) obj;
        return index.get().equals(other.index.get()) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index.get(), values);
    }

    @Override
    public String toString() {
        return "Series{index=" + index.get().labels() + ", values=" + values.toList() + "}";
    }
}
