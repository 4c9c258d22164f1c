package io.tabula.frame;

import io.tabula.column.Aggregation;
import io.tabula.column.Column;

import java.util.List;

/**
 * Grouping of a {@link Series}, with per-group reducers.
 */
public final class SeriesGroupBy<L, G extends Comparable<? super G>> extends GroupBy<Series<L>, G> {

    SeriesGroupBy(Series<L> source, List<? extends G> keys) {
        super(source, keys, source == null ? null : source.configuration());
    }

    /**
     * Reduce every group with {@code aggregation}; results are labeled by key, ascending.
     */
    public Series<G> aggregate(Aggregation aggregation) {
        if (aggregation == null) {
            throw new IllegalArgumentException("aggregation required");
        }
        Column values = source().values();
        List<G> keys = groups();
        List<Object> results = evaluate(keys, key -> aggregation.apply(values.gatherUnchecked(positions(key))));
        return collect(keys, results, aggregation.resultType(values.dtype()));
    }

    public Series<G> sum() {
        return aggregate(Aggregation.SUM);
    }

    public Series<G> count() {
        return aggregate(Aggregation.COUNT);
    }

    public Series<G> mean() {
        return aggregate(Aggregation.MEAN);
    }

    public Series<G> var() {
        return aggregate(Aggregation.VAR);
    }

    public Series<G> unbiasedVar() {
        return aggregate(Aggregation.UNBIASED_VAR);
    }

    public Series<G> std() {
        return aggregate(Aggregation.STD);
    }

    public Series<G> unbiasedStd() {
        return aggregate(Aggregation.UNBIASED_STD);
    }

    public Series<G> min() {
        return aggregate(Aggregation.MIN);
    }

    public Series<G> max() {
        return aggregate(Aggregation.MAX);
    }
}
