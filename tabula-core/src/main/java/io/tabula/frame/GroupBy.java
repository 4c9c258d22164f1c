package io.tabula.frame;

import io.tabula.column.Columns;
import io.tabula.column.DType;
import io.tabula.core.TabulaConfiguration;
import io.tabula.core.TabulaException;
import io.tabula.index.Indexer;
import io.tabula.kernel.Cow;
import io.tabula.kernel.HashGrouper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Rows of a source grouped by a key sequence aligned 1:1 with them.
 * <p>
 * Groups are enumerated in ascending key order. Per-group evaluations read disjoint row sets of
 * an immutable source, so with {@link TabulaConfiguration#enableParallelApply()} they may run on
 * a parallel stream; results are still collected in key order and each key is evaluated once.
 *
 * @param <S> grouped container type
 * @param <G> group key type
 */
public class GroupBy<S extends RowIndexed<S>, G extends Comparable<? super G>> {
    private static final Logger LOG = LoggerFactory.getLogger(GroupBy.class);

    private final S source;
    private final HashGrouper<G> grouper;
    private final TabulaConfiguration configuration;

    GroupBy(S source, List<? extends G> keys, TabulaConfiguration configuration) {
        if (source == null) {
            throw new IllegalArgumentException("source required");
        }
        if (keys == null) {
            throw new IllegalArgumentException("keys required");
        }
        if (keys.size() != source.size()) {
            throw TabulaException.lengthMismatch("group keys", source.size(), keys.size());
        }
        this.source = source;
        this.grouper = HashGrouper.build(keys);
        this.configuration = configuration;
        LOG.debug("Grouped {} rows into {} groups", grouper.rowCount(), grouper.groupCount());
    }

    /**
     * Generic grouping over any row-indexed source, using default configuration.
     */
    public static <S extends RowIndexed<S>, G extends Comparable<? super G>> GroupBy<S, G> of(
            S source, List<? extends G> keys) {
        return new GroupBy<>(source, keys, TabulaConfiguration.defaults());
    }

    public S source() {
        return source;
    }

    /**
     * Rows of {@code key}'s group, in source order.
     *
     * @throws TabulaException with {@code GROUP_NOT_FOUND} when no row carries {@code key}
     */
    public S getGroup(G key) {
        return source.iloc(positions(key));
    }

    /**
     * Distinct keys, ascending.
     */
    public List<G> groups() {
        return grouper.sortedKeys(Comparator.naturalOrder());
    }

    public int ngroups() {
        return grouper.groupCount();
    }

    /**
     * Row count per group, labeled by key in ascending order.
     */
    public Series<G> sizes() {
        List<G> keys = groups();
        List<Long> counts = new ArrayList<>(keys.size());
        for (G key : keys) {
            counts.add((long) grouper.count(key));
        }
        return collect(keys, counts, DType.LONG);
    }

    /**
     * Evaluate {@code function} once per group, in ascending key order, and label each result
     * with its key. The result dtype follows the returned values.
     */
    public <W> Series<G> apply(Function<? super S, W> function) {
        return apply(function, DType.DOUBLE);
    }

    /**
     * Like {@link #apply(Function)}, with the dtype to use when there are no groups.
     */
    public <W> Series<G> apply(Function<? super S, W> function, DType emptyType) {
        if (function == null) {
            throw new IllegalArgumentException("function required");
        }
        List<G> keys = groups();
        List<W> results = evaluate(keys, key -> function.apply(getGroup(key)));
        return collect(keys, results, Columns.inferDType(results, emptyType));
    }

    int[] positions(G key) {
        int[] positions = grouper.positions(key);
        if (positions == null) {
            throw TabulaException.groupNotFound(key);
        }
        return positions;
    }

    TabulaConfiguration configuration() {
        return configuration;
    }

    <W> List<W> evaluate(List<G> keys, Function<G, W> perGroup) {
        if (configuration.enableParallelApply() && keys.size() >= configuration.parallelApplyThreshold()) {
            LOG.debug("Evaluating {} groups in parallel", keys.size());
            return IntStream.range(0, keys.size())
                    .parallel()
                    .mapToObj(i -> perGroup.apply(keys.get(i)))
                    .collect(Collectors.toList());
        }
        List<W> results = new ArrayList<>(keys.size());
        for (G key : keys) {
            results.add(perGroup.apply(key));
        }
        return results;
    }

    Series<G> collect(List<G> keys, List<?> results, DType dtype) {
        return new Series<>(Cow.owned(new Indexer<>(keys)), Columns.fromValues(results, dtype), configuration);
    }
}
