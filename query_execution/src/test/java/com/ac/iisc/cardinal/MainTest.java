package com.ac.iisc.cardinal;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.json.JSONObject;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class MainTest
{
    private static final String SAMPLE_DIRECTIVE = "/*+ SeqScan(v) SeqScan(p) SeqScan(u) HashJoin(p u) HashJoin(v p u) */";
    private static final String SCAN_PLAN = "[{\"Plan\": {\"Node Type\": \"Seq Scan\", \"Relation Name\": \"users\", \"Alias\": \"u\"}}]";

    @TempDir
    Path dir;

    private FakeExecutionAdapter adapter;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp()
    {
        adapter = new FakeExecutionAdapter();
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int runWithStdin(String stdin, String... args)
    {
        Main main = new Main(() -> adapter, new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
            new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
        return main.run(args);
    }

    private int run(String... args)
    {
        return runWithStdin("", args);
    }

    private String stdout()
    {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr()
    {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testHintsFromArgument()
    {
        assertEquals(0, run("hints", SCAN_PLAN));
        assertEquals("/*+ SeqScan(u) */", stdout().trim());
    }

    @Test
    void testHintsVerboseBreakdown()
    {
        assertEquals(0, run("hints", "-v", SCAN_PLAN));
        assertTrue(stdout().contains("Hint string: /*+ SeqScan(u) */"));
        assertTrue(stdout().contains("Scan hints: [SeqScan(u)]"));
        assertTrue(stdout().contains("Join hints: []"));
    }

    @Test
    void testHintsFromFileAndStdin() throws Exception
    {
        Path plan = dir.resolve("plan.json");
        Files.writeString(plan, SCAN_PLAN);

        assertEquals(0, run("hints", "--file", plan.toString()));
        assertEquals("/*+ SeqScan(u) */", stdout().trim());

        out.reset();
        assertEquals(0, runWithStdin(SCAN_PLAN, "hints", "--stdin"));
        assertEquals("/*+ SeqScan(u) */", stdout().trim());
    }

    @Test
    void testHintsWithoutInputRunsSample()
    {
        assertEquals(0, run("hints"));
        assertTrue(stdout().contains("Generated hints: " + SAMPLE_DIRECTIVE));
        assertTrue(stdout().contains("Join hints: [HashJoin(p u), HashJoin(v p u)]"));

        out.reset();
        assertEquals(0, run("hints", "--test", SCAN_PLAN));
        assertTrue(stdout().contains(SAMPLE_DIRECTIVE));
    }

    @Test
    void testHintsErrors()
    {
        assertEquals(1, run("hints", "{\"Plan\": "));
        assertTrue(stderr().contains("Invalid JSON"));

        assertEquals(1, run("hints", "-f", dir.resolve("missing.json").toString()));
        assertTrue(stderr().contains("File not found"));

        assertEquals(2, run("hints", "--bogus"));
        assertTrue(stderr().contains("unrecognized argument: --bogus"));
    }

    @Test
    void testUsage()
    {
        assertEquals(1, run());
        assertTrue(stderr().contains("Usage: cardinal"));
        assertEquals(0, run("--help"));
        assertEquals(2, run("explain"));
    }

    @Test
    void testQueryAnalyzesAndBenchmarks()
    {
        JSONObject plan = new JSONObject(SCAN_PLAN.substring(1, SCAN_PLAN.length() - 1));
        adapter.onAnalyze = q -> ExecutionResult.success(q).executionPlan(plan).analyzed(true)
            .actualTotalTime(1.234).actualRows(3.0).build();

        assertEquals(0, run("query", "-q", "select * from users u", "-i", "2"));

        String text = stdout();
        assertTrue(text.contains("=== Execution Plan Analysis ==="));
        assertTrue(text.contains("actual_total_time: 1.23"));
        assertTrue(text.contains("extracted_hints: /*+ SeqScan(u) */"));
        assertTrue(text.contains("Hints: /*+ SeqScan(u) */"));
        assertTrue(text.contains("=== Benchmark Results (2 iterations) ==="));
        assertFalse(text.contains("=== Execution Plan Tree ==="));
        assertEquals(1, adapter.analyzeCalls.get());
        assertEquals(2, adapter.runCalls.get());
    }

    @Test
    void testQueryVerbosePrintsTree()
    {
        JSONObject plan = new JSONObject(SCAN_PLAN.substring(1, SCAN_PLAN.length() - 1));
        adapter.onAnalyze = q -> ExecutionResult.success(q).executionPlan(plan).analyzed(true).actualTotalTime(1.0).build();

        assertEquals(0, run("query", "-q", "select 1", "-i", "1", "-v"));
        assertTrue(stdout().contains("=== Execution Plan Tree ==="));
        assertTrue(stdout().contains("  Table: users"));
        assertEquals(0, adapter.runCalls.get());
    }

    @Test
    void testQueryUsesHintsFromPlan()
    {
        assertEquals(0, run("query", "-q", "select * from users u", "-i", "1", "--plan-to-hints", SCAN_PLAN));

        assertTrue(stdout().contains("Using extracted hints for execution."));
        assertEquals(List.of("/*+ SeqScan(u) */"), adapter.directives);
    }

    @Test
    void testExplicitHintsWinOverPlan()
    {
        assertEquals(0, run("query", "-q", "select 1", "-i", "1", "--hints", "/*+ HashJoin(a b) */", "--plan-to-hints", SCAN_PLAN));

        assertEquals(List.of("/*+ HashJoin(a b) */"), adapter.directives);
    }

    @Test
    void testPlanWithoutQueryOnlyPrintsHints()
    {
        assertEquals(0, run("query", "--plan-to-hints", SCAN_PLAN));
        assertTrue(stdout().contains("Hints: /*+ SeqScan(u) */"));
        assertEquals(0, adapter.totalCalls());
    }

    @Test
    void testQueryErrors()
    {
        assertEquals(1, run("query", "-q", "select 1", "-i", "21"));
        assertTrue(stderr().contains("Iterations must be between 1 and 20"));

        assertEquals(1, run("query"));
        assertEquals(2, run("query", "-q", "select 1", "--fast"));

        adapter.onAnalyze = q -> ExecutionResult.failure(q, "relation \"nope\" does not exist");
        assertEquals(1, run("query", "-q", "select * from nope", "-i", "1"));
        assertTrue(stdout().contains("Error: relation \"nope\" does not exist"));
        assertEquals(1, adapter.analyzeCalls.get());
    }

    @Test
    void testBatchWritesTimings() throws Exception
    {
        Path csv = dir.resolve("queries.csv");
        Files.writeString(csv, "query\nselect 1\nselect 2\n");

        assertEquals(0, run("batch", csv.toString(), "-w", "2"));

        QueryTable result = QueryTable.read(dir.resolve("queries_with_times.csv"));
        assertEquals(List.of("query", "plan_json", "execution_time"), result.getColumns());
        assertEquals("10.0", result.get(1, "execution_time"));
        assertTrue(stdout().contains("Processed 2 queries (0 failed)"));
    }

    @Test
    void testBatchErrors() throws Exception
    {
        Path csv = dir.resolve("bad.csv");
        Files.writeString(csv, "sql\nselect 1\n");

        assertEquals(1, run("batch", csv.toString(), "-o", dir.resolve("out.csv").toString()));
        assertTrue(stderr().contains("'query' column"));
        assertFalse(Files.exists(dir.resolve("out.csv")));

        Path unquoted = dir.resolve("unquoted.csv");
        Files.writeString(unquoted, "query\nselect a, b from t\n");
        assertEquals(1, run("batch", unquoted.toString()));
        assertTrue(stderr().contains("expected 1 fields in record 2, saw 2"));

        assertEquals(1, run("batch", dir.resolve("absent.csv").toString()));
        assertEquals(1, run("batch", csv.toString(), "-w", "0"));
        assertEquals(0, adapter.totalCalls());
    }
}
