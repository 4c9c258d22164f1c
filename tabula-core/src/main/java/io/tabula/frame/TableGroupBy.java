package io.tabula.frame;

import io.tabula.column.Aggregation;
import io.tabula.column.Column;
import io.tabula.column.Columns;
import io.tabula.index.Indexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Grouping of a {@link Table}. Reducers produce a table labeled by group key (ascending) with
 * one column per numeric source column.
 */
public final class TableGroupBy<R, C, G extends Comparable<? super G>> extends GroupBy<Table<R, C>, G> {

    TableGroupBy(Table<R, C> source, List<? extends G> keys) {
        super(source, keys, source == null ? null : source.configuration());
    }

    public Table<G, C> aggregate(Aggregation aggregation) {
        if (aggregation == null) {
            throw new IllegalArgumentException("aggregation required");
        }
        Table<R, C> numeric = source().numericSubset();
        List<G> keys = groups();
        List<Column> reduced = new ArrayList<>(numeric.ncols());
        for (int i = 0; i < numeric.ncols(); i++) {
            Column column = numeric.icolumn(i).values();
            List<Object> results = evaluate(keys, key -> aggregation.apply(column.gatherUnchecked(positions(key))));
            reduced.add(Columns.fromValues(results, aggregation.resultType(column.dtype())));
        }
        return Table.of(reduced, new Indexer<>(keys), numeric.columns(), configuration());
    }

    public Table<G, C> sum() {
        return aggregate(Aggregation.SUM);
    }

    public Table<G, C> count() {
        return aggregate(Aggregation.COUNT);
    }

    public Table<G, C> mean() {
        return aggregate(Aggregation.MEAN);
    }

    public Table<G, C> var() {
        return aggregate(Aggregation.VAR);
    }

    public Table<G, C> unbiasedVar() {
        return aggregate(Aggregation.UNBIASED_VAR);
    }

    public Table<G, C> std() {
        return aggregate(Aggregation.STD);
    }

    public Table<G, C> unbiasedStd() {
        return aggregate(Aggregation.UNBIASED_STD);
    }

    public Table<G, C> min() {
        return aggregate(Aggregation.MIN);
    }

    public Table<G, C> max() {
        return aggregate(Aggregation.MAX);
    }
}
