package com.ac.iisc.cardinal;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

public class BenchmarkWorkerTest
{
    private static final String PLAN = "[{\"Plan\": {\"Node Type\": \"Seq Scan\", \"Relation Name\": \"t\"}}]";

    private final FakeExecutionAdapter adapter = new FakeExecutionAdapter();

    private BenchmarkResult run(BenchmarkTask task)
    {
        return new BenchmarkWorker(task, adapter, new HintCompiler()).call();
    }

    @Test
    void testPlainSingleRunUsesWallTime()
    {
        BenchmarkResult result = run(new BenchmarkTask(7, "select 1", null, false, 1));

        assertTrue(result.isSuccess());
        assertEquals(7, result.getRowIndex());
        assertEquals(10.0, result.getExecutionTimeMs());
        assertEquals(1, adapter.runCalls.get());
        assertEquals(0, adapter.directiveCalls.get());
    }

    @Test
    void testHintedSingleRunUsesCompiledDirective()
    {
        BenchmarkResult result = run(new BenchmarkTask(0, "select * from t", PLAN, true, 1));

        assertEquals(5.0, result.getExecutionTimeMs());
        assertEquals(List.of("/*+ SeqScan(t) */"), adapter.directives);
        assertEquals(0, adapter.runCalls.get());
    }

    @Test
    void testPlanIgnoredWithoutUseHints()
    {
        run(new BenchmarkTask(0, "select * from t", PLAN, false, 1));

        assertEquals(1, adapter.runCalls.get());
        assertEquals(0, adapter.directiveCalls.get());
    }

    @Test
    void testMalformedPlanRunsUnhinted()
    {
        BenchmarkResult result = run(new BenchmarkTask(3, "select 1", "{\"Plan\": oops", true, 1));

        assertTrue(result.isSuccess());
        assertEquals(1, adapter.runCalls.get());
        assertEquals(0, adapter.directiveCalls.get());
    }

    @Test
    void testBlankAliasFallsBackToRelationName()
    {
        String plan = "{\"Plan\": {\"Node Type\": \"Seq Scan\", \"Relation Name\": \"t\", \"Alias\": \" \"}}";
        BenchmarkResult result = run(new BenchmarkTask(0, "select * from t", plan, true, 1));

        assertTrue(result.isSuccess(), result::getError);
        assertEquals(List.of("/*+ SeqScan(t) */"), adapter.directives);
    }

    @Test
    void testBlankTableNamesRunUnhinted()
    {
        String plan = "{\"Plan\": {\"Node Type\": \"Seq Scan\", \"Relation Name\": \"\", \"Alias\": \" \"}}";
        BenchmarkResult result = run(new BenchmarkTask(0, "select 1", plan, true, 1));

        assertTrue(result.isSuccess(), result::getError);
        assertEquals(1, adapter.runCalls.get());
        assertEquals(0, adapter.directiveCalls.get());
    }

    @Test
    void testCompileFailureRunsUnhinted()
    {
        HintCompiler failing = new HintCompiler()
        {
            @Override
            public String compile(PlanNode root)
            {
                throw new IllegalArgumentException("table must not be null or blank");
            }
        };

        BenchmarkResult result = new BenchmarkWorker(new BenchmarkTask(4, "select * from t", PLAN, true, 1), adapter, failing).call();

        assertTrue(result.isSuccess(), result::getError);
        assertEquals(4, result.getRowIndex());
        assertEquals(1, adapter.runCalls.get());
        assertEquals(0, adapter.directiveCalls.get());
    }

    @Test
    void testPlanWithoutHintableOperatorsRunsUnhinted()
    {
        run(new BenchmarkTask(0, "select 1", "{\"Plan\": {\"Node Type\": \"Result\"}}", true, 1));

        assertEquals(1, adapter.runCalls.get());
    }

    @Test
    void testPlainAverageIsRounded()
    {
        double[] times = {1.0, 1.0, 1.001};
        AtomicInteger n = new AtomicInteger();
        adapter.onRun = q -> ExecutionResult.success(q).executionTimeMs(times[n.getAndIncrement()]).build();

        BenchmarkResult result = run(new BenchmarkTask(0, "q", null, false, 3));

        assertEquals(1.0, result.getExecutionTimeMs());
        assertEquals(3, adapter.runCalls.get());
    }

    @Test
    void testHintedAverage()
    {
        AtomicInteger n = new AtomicInteger();
        adapter.onDirective = (q, d) -> ExecutionResult.success(q).actualTotalTime(n.incrementAndGet() * 1.0).build();

        BenchmarkResult result = run(new BenchmarkTask(0, "q", PLAN, true, 4));

        assertEquals(2.5, result.getExecutionTimeMs(), 1e-9);
        assertEquals(4, adapter.directiveCalls.get());
    }

    @Test
    void testAdapterErrorBecomesRowError()
    {
        adapter.onDirective = (q, d) -> ExecutionResult.failure(q, "Failed to execute with hints: syntax error");

        BenchmarkResult result = run(new BenchmarkTask(2, "q", PLAN, true, 1));

        assertFalse(result.isSuccess());
        assertEquals("Failed to execute with hints: syntax error", result.getError());
    }

    @Test
    void testMissingTimingIsRowError()
    {
        adapter.onRun = q -> ExecutionResult.success(q).build();

        assertEquals(QueryBenchmarker.NO_TIMING, run(new BenchmarkTask(0, "q", null, false, 1)).getError());
    }

    @Test
    void testBlankQueryNeverReachesAdapter()
    {
        BenchmarkResult result = run(new BenchmarkTask(4, "  ", null, false, 1));

        assertEquals(BenchmarkWorker.EMPTY_QUERY, result.getError());
        assertEquals(0, adapter.totalCalls());
    }

    @Test
    void testRuntimeExceptionIsCaught()
    {
        adapter.onRun = q -> { throw new IllegalStateException("pool closed"); };

        BenchmarkResult result = run(new BenchmarkTask(1, "q", null, false, 1));

        assertEquals("java.lang.IllegalStateException: pool closed", result.getError());
    }

    @Test
    void testErrorsEscapeTheWorker()
    {
        adapter.onRun = q -> { throw new AssertionError("boom"); };

        assertThrows(AssertionError.class, () -> run(new BenchmarkTask(1, "q", null, false, 1)));
    }
}
