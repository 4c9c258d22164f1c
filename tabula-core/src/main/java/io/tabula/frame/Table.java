package io.tabula.frame;

import io.tabula.column.Aggregation;
import io.tabula.column.Column;
import io.tabula.column.Columns;
import io.tabula.column.DType;
import io.tabula.core.ColumnCollisionPolicy;
import io.tabula.core.ErrorKind;
import io.tabula.core.TabulaConfiguration;
import io.tabula.core.TabulaException;
import io.tabula.index.Indexer;
import io.tabula.kernel.Cow;
import io.tabula.kernel.HashJoin;
import io.tabula.kernel.IntSelection;
import io.tabula.kernel.JoinPairs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Labeled two-dimensional table: a row {@link Indexer}, a column {@link Indexer} and one
 * {@link Column} per column label, all columns as long as the row index.
 * <p>
 * <b>Sharing:</b> the row index, the column index and each column are held through
 * {@link Cow} slots. Slicing hands the untouched parts to the result as shared views, and both
 * sides then treat them as read-only. {@link #insert(Column, Object)} is the only mutation; it
 * copies a shared column index before pushing to it, so no other table observes the change.
 * The {@link #index()} and {@link #columns()} getters return read-only views.
 * <p>
 * Sharing only sets a flag on the slot, so reads may run concurrently. Tables are not safe for
 * concurrent mutation.
 *
 * @param <R> row label type
 * @param <C> column label type
 */
public final class Table<R, C> implements RowIndexed<Table<R, C>> {
    private static final Logger LOG = LoggerFactory.getLogger(Table.class);

    private final Cow<Indexer<R>> index;
    private Cow<Indexer<C>> columns;
    private final List<Cow<Column>> values;
    private final TabulaConfiguration configuration;

    private Table(Cow<Indexer<R>> index, Cow<Indexer<C>> columns, List<Cow<Column>> values,
                  TabulaConfiguration configuration) {
        this.index = index;
        this.columns = columns;
        this.values = values;
        this.configuration = configuration;
    }

    /**
     * Table labeled {@code 0..n-1} by row.
     */
    public static <C> Table<Integer, C> of(List<? extends Column> values, List<? extends C> columnLabels) {
        if (values == null) {
            throw new IllegalArgumentException("values required");
        }
        int rows = values.isEmpty() ? 0 : requireColumn(values.get(0)).size();
        return create(values, Indexer.range(rows), new Indexer<C>(requireLabels(columnLabels)),
                TabulaConfiguration.defaults());
    }

    public static <R, C> Table<R, C> of(List<? extends Column> values, List<? extends R> index,
                                        List<? extends C> columnLabels) {
        return of(values, index, columnLabels, TabulaConfiguration.defaults());
    }

    public static <R, C> Table<R, C> of(List<? extends Column> values, List<? extends R> index,
                                        List<? extends C> columnLabels, TabulaConfiguration configuration) {
        if (index == null) {
            throw new IllegalArgumentException("index required");
        }
        return create(values, new Indexer<R>(index), new Indexer<C>(requireLabels(columnLabels)), configuration);
    }

    public static <R, C> Table<R, C> of(List<? extends Column> values, Indexer<R> index, Indexer<C> columnLabels,
                                        TabulaConfiguration configuration) {
        if (index == null) {
            throw new IllegalArgumentException("index required");
        }
        if (columnLabels == null) {
            throw new IllegalArgumentException("columnLabels required");
        }
        return create(values, index.copy(), columnLabels.copy(), configuration);
    }

    private static <R, C> Table<R, C> create(List<? extends Column> values, Indexer<R> index, Indexer<C> columns,
                                             TabulaConfiguration configuration) {
        if (values == null) {
            throw new IllegalArgumentException("values required");
        }
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        if (values.size() != columns.size()) {
            throw TabulaException.lengthMismatch("column labels", values.size(), columns.size());
        }
        List<Cow<Column>> slots = new ArrayList<>(values.size());
        for (Column column : values) {
            requireColumn(column);
            if (column.size() != index.size()) {
                throw TabulaException.lengthMismatch("column", index.size(), column.size());
            }
            slots.add(Cow.owned(column));
        }
        return new Table<>(Cow.owned(index), Cow.owned(columns), slots, configuration);
    }

    // Dimensions and metadata

    @Override
    public int size() {
        return index.get().size();
    }

    public int ncols() {
        return values.size();
    }

    /**
     * Row labels, as a read-only view.
     */
    public Indexer<R> index() {
        return index.get().readOnlyView();
    }

    /**
     * Column labels, as a read-only view. A later {@link #insert(Column, Object)} does not show
     * through the returned view.
     */
    public Indexer<C> columns() {
        return shareColumns().get().readOnlyView();
    }

    public TabulaConfiguration configuration() {
        return configuration;
    }

    public List<DType> dtypes() {
        List<DType> dtypes = new ArrayList<>(values.size());
        for (Cow<Column> slot : values) {
            dtypes.add(slot.get().dtype());
        }
        return Collections.unmodifiableList(dtypes);
    }

    public List<Boolean> isNumeric() {
        List<Boolean> flags = new ArrayList<>(values.size());
        for (Cow<Column> slot : values) {
            flags.add(slot.get().isNumeric());
        }
        return Collections.unmodifiableList(flags);
    }

    // Column access

    /**
     * Column {@code label} as a series sharing this table's row index.
     *
     * @throws TabulaException {@code UNKNOWN_LABEL}, or {@code AMBIGUOUS_LABEL} for a duplicated label
     */
    public Series<R> column(C label) {
        return icolumn(columns.get().getLoc(label));
    }

    public Series<R> icolumn(int position) {
        if (position < 0 || position >= values.size()) {
            throw TabulaException.outOfBounds(position, values.size());
        }
        return new Series<>(shareIndex(), values.get(position).get(), configuration);
    }

    /**
     * Column slice by label; see {@link #igets(int[])}.
     */
    public Table<R, C> gets(List<? extends C> labels) {
        return igets(columns.get().getLocs(labels, configuration.duplicateLabelPolicy()));
    }

    /**
     * Column slice by position. The selected columns and the row index are shared with the
     * result; no row data is copied.
     */
    public Table<R, C> igets(int[] positions) {
        Indexer<C> newColumns = columns.get().reindex(positions);
        List<Cow<Column>> selected = new ArrayList<>(positions.length);
        for (int position : positions) {
            selected.add(shareColumn(position));
        }
        return new Table<>(shareIndex(), Cow.owned(newColumns), selected, configuration);
    }

    public Table<R, C> numericSubset() {
        IntSelection numeric = new IntSelection(values.size());
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i).get().isNumeric()) {
                numeric.add(i);
            }
        }
        return igets(numeric.toIntArray());
    }

    // Row access

    /**
     * Rows by label, resolved with the configured duplicate-label policy.
     */
    public Table<R, C> loc(List<? extends R> labels) {
        return iloc(index.get().getLocs(labels, configuration.duplicateLabelPolicy()));
    }

    /**
     * Rows by position. Every column is gathered independently; the column index is shared.
     */
    @Override
    public Table<R, C> iloc(int[] positions) {
        Indexer<R> newIndex = index.get().reindex(positions);
        // boundaries are checked in Indexer.reindex
        List<Cow<Column>> gathered = new ArrayList<>(values.size());
        for (Cow<Column> slot : values) {
            gathered.add(Cow.owned(slot.get().gatherUnchecked(positions)));
        }
        return new Table<>(Cow.owned(newIndex), shareColumns(), gathered, configuration);
    }

    /**
     * Rows whose flag in {@code mask} is set.
     */
    public Table<R, C> filter(boolean[] mask) {
        return iloc(Series.maskPositions(mask, size()));
    }

    // Mutation

    /**
     * Append {@code column} under {@code label}. Only this table changes; tables sharing this
     * table's column index keep their own view.
     *
     * @throws TabulaException with {@code LENGTH_MISMATCH} when the column size differs from the row count
     */
    public void insert(Column column, C label) {
        requireColumn(column);
        if (label == null) {
            throw new IllegalArgumentException("label required");
        }
        if (column.size() != size()) {
            throw TabulaException.lengthMismatch("column", size(), column.size());
        }
        columns = columns.toOwned(Indexer::copy);
        columns.get().push(label);
        values.add(Cow.owned(column));
    }

    // Aggregation

    /**
     * Reduce each numeric column with {@code aggregation}, labeled by column.
     */
    public Series<C> aggregate(Aggregation aggregation) {
        if (aggregation == null) {
            throw new IllegalArgumentException("aggregation required");
        }
        Table<R, C> numeric = numericSubset();
        List<Object> results = new ArrayList<>(numeric.ncols());
        for (Cow<Column> slot : numeric.values) {
            results.add(aggregation.apply(slot.get()));
        }
        DType dtype = Columns.inferDType(results, aggregation.resultType(DType.DOUBLE));
        return new Series<>(numeric.shareColumns(), Columns.fromValues(results, dtype), configuration);
    }

    public Series<C> sum() {
        return aggregate(Aggregation.SUM);
    }

    public Series<C> count() {
        return aggregate(Aggregation.COUNT);
    }

    public Series<C> mean() {
        return aggregate(Aggregation.MEAN);
    }

    public Series<C> var() {
        return aggregate(Aggregation.VAR);
    }

    public Series<C> unbiasedVar() {
        return aggregate(Aggregation.UNBIASED_VAR);
    }

    public Series<C> std() {
        return aggregate(Aggregation.STD);
    }

    public Series<C> unbiasedStd() {
        return aggregate(Aggregation.UNBIASED_STD);
    }

    public Series<C> min() {
        return aggregate(Aggregation.MIN);
    }

    public Series<C> max() {
        return aggregate(Aggregation.MAX);
    }

    /**
     * Group rows by {@code keys}, aligned 1:1 with this table's rows.
     */
    public <G extends Comparable<? super G>> TableGroupBy<R, C, G> groupBy(List<? extends G> keys) {
        return new TableGroupBy<>(this, keys);
    }

    // Join and reshape

    /**
     * Inner equi-join on row labels. For each left row, in order, one output row per matching
     * right row, in right order. Columns are this table's followed by {@code other}'s.
     */
    public Table<R, C> joinInner(Table<R, C> other) {
        if (other == null) {
            throw new IllegalArgumentException("other required");
        }
        checkCollisions(other);
        JoinPairs<R> pairs = HashJoin.inner(index.get().labels(), other.index.get().labels());
        LOG.debug("Inner join matched {} rows ({} left, {} right)", pairs.size(), size(), other.size());

        int[] leftPositions = pairs.leftPositions();
        int[] rightPositions = pairs.rightPositions();
        List<Cow<Column>> joined = new ArrayList<>(values.size() + other.values.size());
        for (Cow<Column> slot : values) {
            joined.add(Cow.owned(slot.get().gatherUnchecked(leftPositions)));
        }
        for (Cow<Column> slot : other.values) {
            joined.add(Cow.owned(slot.get().gatherUnchecked(rightPositions)));
        }
        Indexer<C> newColumns = columns.get().append(other.columns.get());
        return new Table<>(Cow.owned(new Indexer<>(pairs.labels())), Cow.owned(newColumns), joined, configuration);
    }

    /**
     * Rows of {@code other} below this table's rows.
     *
     * @throws TabulaException {@code COLUMNS_DIFFER} unless both tables have equal column labels,
     *                         {@code DTYPE_MISMATCH} when a column's dtype differs between them
     */
    public Table<R, C> append(Table<R, C> other) {
        if (other == null) {
            throw new IllegalArgumentException("other required");
        }
        if (!columns.get().equals(other.columns.get())) {
            throw new TabulaException(ErrorKind.COLUMNS_DIFFER,
                    "columns must be identical: " + columns.get().labels() + " vs " + other.columns.get().labels());
        }
        for (int i = 0; i < values.size(); i++) {
            DType mine = values.get(i).get().dtype();
            DType theirs = other.values.get(i).get().dtype();
            if (mine != theirs) {
                throw new TabulaException(ErrorKind.DTYPE_MISMATCH,
                        "column " + columns.get().label(i) + " is " + mine + " but " + theirs + " in other");
            }
        }
        Indexer<R> newIndex = index.get().append(other.index.get());
        List<Cow<Column>> appended = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            appended.add(Cow.owned(values.get(i).get().append(other.values.get(i).get())));
        }
        return new Table<>(Cow.owned(newIndex), shareColumns(), appended, configuration);
    }

    /**
     * Columns of {@code other} to the right of this table's columns. Both tables' columns are
     * shared with the result.
     *
     * @throws TabulaException {@code INDEX_DIFFER} unless both tables have equal row labels
     */
    public Table<R, C> concat(Table<R, C> other) {
        if (other == null) {
            throw new IllegalArgumentException("other required");
        }
        if (!index.get().equals(other.index.get())) {
            throw new TabulaException(ErrorKind.INDEX_DIFFER, "index must be identical");
        }
        checkCollisions(other);
        Indexer<C> newColumns = columns.get().append(other.columns.get());
        List<Cow<Column>> combined = new ArrayList<>(values.size() + other.values.size());
        for (int i = 0; i < values.size(); i++) {
            combined.add(shareColumn(i));
        }
        for (int i = 0; i < other.values.size(); i++) {
            combined.add(other.shareColumn(i));
        }
        return new Table<>(shareIndex(), Cow.owned(newColumns), combined, configuration);
    }

    // Sharing

    Cow<Indexer<R>> indexSlot() {
        return index;
    }

    Cow<Indexer<C>> columnsSlot() {
        return columns;
    }

    Cow<Column> columnSlot(int position) {
        return values.get(position);
    }

    private Cow<Indexer<R>> shareIndex() {
        return index.share();
    }

    private Cow<Indexer<C>> shareColumns() {
        return columns.share();
    }

    private Cow<Column> shareColumn(int position) {
        return values.get(position).share();
    }

    private void checkCollisions(Table<R, C> other) {
        if (configuration.columnCollisionPolicy() != ColumnCollisionPolicy.REJECT) {
            return;
        }
        for (C label : other.columns.get().labels()) {
            if (columns.get().contains(label)) {
                throw new TabulaException(ErrorKind.COLUMN_COLLISION, "column label on both sides: " + label);
            }
        }
    }

    private static Column requireColumn(Column column) {
        if (column == null) {
            throw new IllegalArgumentException("column required");
        }
        return column;
    }

    private static <T> List<T> requireLabels(List<T> labels) {
        if (labels == null) {
            throw new IllegalArgumentException("columnLabels required");
        }
        return labels;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        Table<?, ?> other = (Table<?, ?>) obj;
        if (!index.get().equals(other.index.get()) || !columns.get().equals(other.columns.get())) {
            return false;
        }
        for (int i = 0; i < values.size(); i++) {
            if (!values.get(i).get().equals(other.values.get(i).get())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(index.get(), columns.get());
        for (Cow<Column> slot : values) {
            result = 31 * result + slot.get().hashCode();
        }
        return result;
    }

    @Override
    public String toString() {
        return "Table{rows=" + size() + ", index=" + index.get().labels() + ", columns=" + columns.get().labels() + "}";
    }
}
