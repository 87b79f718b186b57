package com.ac.iisc.cardinal;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs benchmark tasks on a fixed pool of worker threads and lines the results up
 * with their input rows.
 *
 * Responsibilities:
 * - Validate the whole batch before anything runs (worker count, iteration counts,
 *   unique row indexes); a bad batch throws {@link BenchmarkConfigurationException}.
 * - Submit every task at once, then collect results in completion order through an
 *   {@link ExecutorCompletionService}. Each result is stored under the row index of the
 *   future that produced it, and only the calling thread writes results.
 * - Turn a worker crash (a throwable that escaped {@link BenchmarkWorker}) into a failed
 *   row. The remaining rows are unaffected.
 * - Log progress every 100 completions and at the end.
 *
 * Tasks have no deadline here; the adapter's statement timeout is what bounds them.
 */
public class BenchmarkOrchestrator {

    private static final Logger LOGGER = LogManager.getLogger(BenchmarkOrchestrator.class);

    static final int PROGRESS_INTERVAL = 100;
    static final String WORKER_CRASHED = "Worker crashed: ";

    private final ExecutionAdapter adapter;
    private final int workers;
    private final boolean verbose;
    private final HintCompiler compiler = new HintCompiler();

    public BenchmarkOrchestrator(ExecutionAdapter adapter, int workers, boolean verbose) {
        if (adapter == null) throw new IllegalArgumentException("adapter must not be null");
        if (workers < 1) throw new BenchmarkConfigurationException("workers must be >= 1, got " + workers);
        this.adapter = adapter;
        this.workers = workers;
        this.verbose = verbose;
    }

    /**
     * Execute all tasks and return one result per task, in the order the tasks were given.
     *
     * @throws BenchmarkConfigurationException if the batch is invalid; nothing has run
     * @throws InterruptedException if the calling thread is interrupted while waiting;
     *         outstanding tasks are cancelled
     */
    public List<BenchmarkResult> execute(List<BenchmarkTask> tasks) throws InterruptedException {
        validate(tasks);
        if (tasks.isEmpty()) return List.of();

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(workers, tasks.size()), new WorkerThreadFactory());
        try {
            CompletionService<BenchmarkResult> completion = new ExecutorCompletionService<>(pool);
            Map<Future<BenchmarkResult>, Integer> rowOf = new HashMap<>();
            for (BenchmarkTask task : tasks) {
                rowOf.put(completion.submit(new BenchmarkWorker(task, adapter, compiler)), task.getRowIndex());
            }

            Map<Integer, BenchmarkResult> results = new HashMap<>();
            int total = tasks.size();
            for (int done = 1; done <= total; done++) {
                Future<BenchmarkResult> future = completion.take();
                int row = rowOf.get(future);
                BenchmarkResult result = collect(future, row);
                results.put(row, result);

                if (verbose) {
                    LOGGER.info("Row {}: {}", row,
                        result.isSuccess() ? result.getExecutionTimeMs() + "ms" : "ERROR " + result.getError());
                }
                if (done % PROGRESS_INTERVAL == 0 || done == total) {
                    LOGGER.info("Processed {}/{} queries", done, total);
                }
            }

            List<BenchmarkResult> ordered = new ArrayList<>(total);
            for (BenchmarkTask task : tasks) ordered.add(results.get(task.getRowIndex()));
            return ordered;
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Benchmark every row of {@code table} and return a copy with the timing column filled
     * in (empty for failed rows). The plan column is added empty when missing.
     */
    public QueryTable runTable(QueryTable table, BenchmarkOptions options) throws InterruptedException {
        if (!table.hasColumn(options.getQueryColumn())) {
            throw new BenchmarkConfigurationException("CSV must contain a '" + options.getQueryColumn() + "' column");
        }
        if (options.getIterations() < 1) {
            throw new BenchmarkConfigurationException("iterations must be >= 1, got " + options.getIterations());
        }

        QueryTable input = table;
        if (!input.hasColumn(options.getPlanColumn())) {
            input = input.withColumn(options.getPlanColumn(), blanks(input.size()));
        }

        List<BenchmarkTask> tasks = new ArrayList<>(input.size());
        for (int r = 0; r < input.size(); r++) {
            String plan = input.get(r, options.getPlanColumn());
            tasks.add(new BenchmarkTask(r, input.get(r, options.getQueryColumn()),
                plan == null || plan.isBlank() ? null : plan,
                options.isUseHints(), options.getIterations()));
        }
        LOGGER.info("Benchmarking {} queries with {} workers (hints={}, iterations={})",
            tasks.size(), workers, options.isUseHints(), options.getIterations());

        List<BenchmarkResult> results = execute(tasks);

        List<String> times = new ArrayList<>(results.size());
        int failed = 0;
        for (BenchmarkResult res : results) {
            if (res.isSuccess()) {
                times.add(formatTime(res.getExecutionTimeMs()));
            } else {
                times.add("");
                failed++;
            }
        }
        if (failed > 0) LOGGER.warn("{} of {} queries failed", failed, results.size());
        return input.withColumn(options.getOutputColumn(), times);
    }

    /** Plain decimal text, never scientific notation. */
    static String formatTime(double ms) {
        return BigDecimal.valueOf(ms).toPlainString();
    }

    private BenchmarkResult collect(Future<BenchmarkResult> future, int row) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOGGER.error("Worker for row {} crashed", row, cause);
            return BenchmarkResult.failure(row, WORKER_CRASHED + cause);
        }
    }

    private static void validate(List<BenchmarkTask> tasks) {
        if (tasks == null) throw new BenchmarkConfigurationException("tasks must not be null");
        Set<Integer> rows = new HashSet<>();
        for (BenchmarkTask task : tasks) {
            if (task == null) throw new BenchmarkConfigurationException("null task in batch");
            if (task.getIterations() < 1) {
                throw new BenchmarkConfigurationException("iterations must be >= 1, got " + task.getIterations()
                    + " for row " + task.getRowIndex());
            }
            if (!rows.add(task.getRowIndex())) {
                throw new BenchmarkConfigurationException("duplicate row index " + task.getRowIndex());
            }
        }
    }

    private static List<String> blanks(int n) {
        List<String> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) out.add("");
        return out;
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "benchmark-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
