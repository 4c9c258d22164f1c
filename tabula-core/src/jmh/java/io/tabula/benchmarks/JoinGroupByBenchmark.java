package io.tabula.benchmarks;

import io.tabula.column.Column;
import io.tabula.column.DoubleColumn;
import io.tabula.column.LongColumn;
import io.tabula.frame.Table;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 2, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class JoinGroupByBenchmark {

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({"10000", "100000"})
        public int rows;

        private Table<Long, String> orders;
        private Table<Long, String> customers;
        private List<Long> regions;

        @Setup(Level.Trial)
        public void setUp() {
            int customerCount = rows / 10;
            List<Long> orderKeys = new ArrayList<>(rows);
            long[] amounts = new long[rows];
            regions = new ArrayList<>(rows);
            for (var i = 0; i < rows; i++) {
                orderKeys.add((long) (i % customerCount));
                amounts[i] = i % 1000;
                regions.add((long) (i % 16));
            }
            List<Long> customerKeys = new ArrayList<>(customerCount);
            double[] scores = new double[customerCount];
            for (var i = 0; i < customerCount; i++) {
                customerKeys.add((long) i);
                scores[i] = i * 0.5;
            }
            orders = Table.of(List.<Column>of(LongColumn.of(amounts)), orderKeys, List.of("amount"));
            customers = Table.of(List.<Column>of(DoubleColumn.of(scores)), customerKeys, List.of("score"));
        }
    }

    @Benchmark
    public int joinInner(BenchmarkState state) {
        return state.orders.joinInner(state.customers).size();
    }

    @Benchmark
    public int groupBySum(BenchmarkState state) {
        return state.orders.groupBy(state.regions).sum().size();
    }

    @Benchmark
    public int locAll(BenchmarkState state) {
        return state.customers.loc(state.customers.index().labels()).size();
    }
}
