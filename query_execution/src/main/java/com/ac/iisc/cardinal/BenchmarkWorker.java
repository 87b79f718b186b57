package com.ac.iisc.cardinal;

import java.util.concurrent.Callable;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs a single {@link BenchmarkTask} and turns every expected failure into a
 * {@link BenchmarkResult} error.
 *
 * Steps:
 * 1. When hints are requested, parse the plan payload and compile it. A payload that
 *    cannot be parsed or compiled leaves the task unhinted, as does an empty directive.
 * 2. Pick a {@link TimingStrategy} and execute through the adapter.
 *
 * Runtime exceptions become row errors here. Anything thrown beyond that (an
 * {@link Error}) escapes to the orchestrator, which reports it as a worker crash.
 */
class BenchmarkWorker implements Callable<BenchmarkResult> {

    private static final Logger LOGGER = LogManager.getLogger(BenchmarkWorker.class);

    static final String EMPTY_QUERY = "Empty query";

    private final BenchmarkTask task;
    private final ExecutionAdapter adapter;
    private final HintCompiler compiler;

    BenchmarkWorker(BenchmarkTask task, ExecutionAdapter adapter, HintCompiler compiler) {
        this.task = task;
        this.adapter = adapter;
        this.compiler = compiler;
    }

    @Override
    public BenchmarkResult call() {
        int row = task.getRowIndex();
        String query = task.getQueryText();
        if (query == null || query.isBlank()) {
            return BenchmarkResult.failure(row, EMPTY_QUERY);
        }

        try {
            String directive = directiveFor(task);
            TimingStrategy strategy = TimingStrategy.select(!directive.isEmpty(), task.getIterations());
            LOGGER.debug("Row {} timed with {}", row, strategy);
            return execute(row, query, directive, strategy);
        } catch (RuntimeException e) {
            LOGGER.debug("Row {} failed", row, e);
            return BenchmarkResult.failure(row, e.toString());
        }
    }

    private String directiveFor(BenchmarkTask t) {
        if (!t.isUseHints() || t.getPlanPayload() == null) return "";
        PlanParseResult parsed = PlanParser.parse(t.getPlanPayload());
        if (!parsed.isParsed()) {
            LOGGER.debug("Row {}: plan not usable ({}), running unhinted", t.getRowIndex(), parsed.getFailureReason());
            return "";
        }
        try {
            return compiler.compile(parsed.getRoot());
        } catch (IllegalArgumentException e) {
            LOGGER.warn("Row {}: could not compile hints ({}), running unhinted", t.getRowIndex(), e.getMessage());
            return "";
        }
    }

    private BenchmarkResult execute(int row, String query, String directive, TimingStrategy strategy) {
        return switch (strategy) {
            case SINGLE_HINTED -> fromExecution(row, adapter.runWithDirective(query, directive));
            case SINGLE_PLAIN -> fromExecution(row, adapter.run(query));
            case AVERAGE_HINTED -> fromSummary(row, new QueryBenchmarker(adapter)
                .benchmarkWithDirective(query, directive, task.getIterations()), false);
            case AVERAGE_PLAIN -> fromSummary(row, new QueryBenchmarker(adapter)
                .benchmark(query, task.getIterations()), true);
        };
    }

    private static BenchmarkResult fromExecution(int row, ExecutionResult res) {
        if (!res.isSuccess()) return BenchmarkResult.failure(row, res.getError());
        Double timing = res.resolveTiming();
        if (timing == null) return BenchmarkResult.failure(row, QueryBenchmarker.NO_TIMING);
        return BenchmarkResult.success(row, timing);
    }

    private static BenchmarkResult fromSummary(int row, BenchmarkSummary summary, boolean round) {
        if (!summary.isSuccess()) return BenchmarkResult.failure(row, summary.getError());
        double avg = summary.getAvgTimeMs();
        return BenchmarkResult.success(row, round ? PostgresExecutionAdapter.round2(avg) : avg);
    }
}
