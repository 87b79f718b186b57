package com.ac.iisc.cardinal;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Repeated-execution helpers on top of an {@link ExecutionAdapter}.
 *
 * - {@link #benchmark(String, int)}: plain runs, wall-clock timing.
 * - {@link #benchmarkWithDirective(String, String, int)}: hinted EXPLAIN ANALYZE runs,
 *   timing taken from {@link ExecutionResult#resolveTiming()}.
 * - {@link #compareStrategies(String, List)}: default plan versus a list of directives.
 *
 * A failing iteration stops the benchmark; there is no partial average.
 */
public class QueryBenchmarker {

    private static final Logger LOGGER = LogManager.getLogger(QueryBenchmarker.class);

    static final String NO_TIMING = "No timing value found";

    private final ExecutionAdapter adapter;

    public QueryBenchmarker(ExecutionAdapter adapter) {
        if (adapter == null) throw new IllegalArgumentException("adapter must not be null");
        this.adapter = adapter;
    }

    /**
     * Execute the query {@code iterations} times and summarize the elapsed times.
     */
    public BenchmarkSummary benchmark(String query, int iterations) {
        requirePositive(iterations);
        List<Double> times = new ArrayList<>(iterations);
        for (int i = 0; i < iterations; i++) {
            ExecutionResult res = adapter.run(query);
            if (!res.isSuccess()) {
                return BenchmarkSummary.failure(query, "Query failed on iteration " + (i + 1) + ": " + res.getError());
            }
            Double t = res.resolveTiming();
            if (t == null) return BenchmarkSummary.failure(query, NO_TIMING);
            times.add(t);
        }
        return BenchmarkSummary.of(query, times);
    }

    /**
     * Execute the hinted query {@code iterations} times and summarize the reported times.
     */
    public BenchmarkSummary benchmarkWithDirective(String query, String directive, int iterations) {
        requirePositive(iterations);
        List<Double> times = new ArrayList<>(iterations);
        for (int i = 0; i < iterations; i++) {
            ExecutionResult res = adapter.runWithDirective(query, directive);
            if (!res.isSuccess()) {
                return BenchmarkSummary.failure(query, res.getError());
            }
            Double t = res.resolveTiming();
            if (t == null) return BenchmarkSummary.failure(query, NO_TIMING);
            times.add(t);
        }
        return BenchmarkSummary.of(query, times);
    }

    /**
     * Run the query once under EXPLAIN ANALYZE with the planner's own choices, then once
     * per directive. Strategies that fail are logged and skipped.
     *
     * @param query      SQL text
     * @param directives directives to try, named hint_1, hint_2, ... in this order
     */
    public StrategyComparison compareStrategies(String query, List<String> directives) {
        List<StrategyComparison.Outcome> outcomes = new ArrayList<>();

        ExecutionResult base = adapter.planAndAnalyze(query);
        if (base.isSuccess()) {
            outcomes.add(new StrategyComparison.Outcome("default", null, timingOrZero(base), base.getActualRows()));
        } else {
            LOGGER.info("Default strategy failed: {}", base.getError());
        }

        if (directives != null) {
            for (int i = 0; i < directives.size(); i++) {
                String directive = directives.get(i);
                ExecutionResult hinted = adapter.runWithDirective(query, directive);
                String name = "hint_" + (i + 1);
                if (hinted.isSuccess()) {
                    outcomes.add(new StrategyComparison.Outcome(name, directive, timingOrZero(hinted), hinted.getActualRows()));
                } else {
                    LOGGER.info("Strategy {} failed: {}", name, hinted.getError());
                }
            }
        }
        return new StrategyComparison(query, outcomes);
    }

    private static double timingOrZero(ExecutionResult res) {
        return res.getActualTotalTime() == null ? 0.0 : res.getActualTotalTime();
    }

    private static void requirePositive(int iterations) {
        if (iterations < 1) throw new IllegalArgumentException("iterations must be >= 1, got " + iterations);
    }
}
