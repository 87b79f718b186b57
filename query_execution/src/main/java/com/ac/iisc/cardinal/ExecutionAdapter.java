package com.ac.iisc.cardinal;

/**
 * Runs SQL against the database on behalf of the benchmark harness and the CLI.
 *
 * Contract for every operation:
 * - Returns an {@link ExecutionResult} that is either a success payload or an error
 *   marker. Database errors are reported through the result, not thrown.
 * - Acquires its own connection for the duration of the call and releases it on every
 *   exit path, so one adapter instance can be used by many worker threads at once.
 * - Applies no retry. Bounding long-running statements (e.g. a statement timeout) is the
 *   implementation's responsibility; callers impose no deadline of their own.
 */
public interface ExecutionAdapter {

    /** Plan the query without running it ({@code EXPLAIN (FORMAT JSON)}). */
    ExecutionResult planOnly(String query);

    /** Run the query under {@code EXPLAIN ANALYZE} and report actual time and rows. */
    ExecutionResult planAndAnalyze(String query);

    /** Execute the query, drain its result set and report elapsed wall time. */
    ExecutionResult run(String query);

    /**
     * Prepend {@code directive} to the query text and run it under {@code EXPLAIN ANALYZE}.
     *
     * @param query     SQL text
     * @param directive pg_hint_plan comment, e.g. {@code /*+ SeqScan(a) *}{@code /}
     */
    ExecutionResult runWithDirective(String query, String directive);
}
