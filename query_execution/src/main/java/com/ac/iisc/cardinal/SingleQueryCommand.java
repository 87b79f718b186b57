package com.ac.iisc.cardinal;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

import org.json.JSONObject;

/**
 * {@code query} command: execute one statement and report on it.
 *
 * Flow:
 * 1) Hints from {@code --hints}, or else extracted from {@code --plan-to-hints}/{@code --plan-file}.
 *    A plan without a query only prints the extracted hints.
 * 2) Hinted execution when hints are present, EXPLAIN ANALYZE otherwise.
 * 3) Result fields, the plan tree in verbose mode, and the hints reproducing the executed plan.
 * 4) A plain benchmark when more than one iteration is requested.
 */
class SingleQueryCommand {

    static final int MAX_ITERATIONS = 20;
    static final int DEFAULT_ITERATIONS = 3;

    private final Supplier<ExecutionAdapter> adapters;
    private final PrintStream out;
    private final HintCompiler compiler = new HintCompiler();

    SingleQueryCommand(Supplier<ExecutionAdapter> adapters, PrintStream out) {
        this.adapters = adapters;
        this.out = out;
    }

    int run(String[] args) throws CliException, IOException {
        String query = null;
        String hints = null;
        int iterations = DEFAULT_ITERATIONS;
        boolean verbose = false;
        String planArg = null;
        String planFile = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "-q", "--query" -> query = Main.optionValue(args, i++);
                case "--hints" -> hints = Main.optionValue(args, i++);
                case "-i", "--iterations" -> iterations = Main.intOption(args, i++);
                case "-v", "--verbose" -> verbose = true;
                case "--plan-to-hints" -> planArg = Main.optionValue(args, i++);
                case "--plan-file" -> planFile = Main.optionValue(args, i++);
                default -> throw CliException.usage("unrecognized arguments: " + HintsCommand.abbreviate(args[i]));
            }
        }

        if (iterations < 1 || iterations > MAX_ITERATIONS) {
            throw CliException.failure("Iterations must be between 1 and " + MAX_ITERATIONS);
        }

        Object plan = null;
        if (planFile != null) {
            plan = HintsCommand.parseJson(
                HintsCommand.readPlanFile(planFile, "Plan file not found: "), "Invalid JSON in plan file");
        } else if (planArg != null) {
            plan = HintsCommand.parseJson(planArg, "Invalid JSON");
        }

        boolean hasQuery = query != null && !query.isBlank();
        if (plan != null && !hasQuery) {
            out.println("=== Plan-to-Hints Conversion ===");
            out.println();
            printHints(plan, verbose);
            return Main.EXIT_OK;
        }
        if (!hasQuery) {
            throw CliException.failure("a query (-q) or a plan (--plan-to-hints, --plan-file) is required");
        }
        return execute(query, hints, iterations, verbose, plan);
    }

    private int execute(String query, String hints, int iterations, boolean verbose, Object plan) {
        if (plan != null) {
            out.println("Extracting hints from provided execution plan...");
            String extracted = compiler.compile(plan);
            out.println("Extracted hints: " + extracted);
            if (hints == null || hints.isEmpty()) {
                hints = extracted;
                out.println("Using extracted hints for execution.");
            }
            out.println();
        }

        boolean hinted = hints != null && !hints.isEmpty();
        out.println("Executing query: " + query);
        if (hinted) out.println("With hints: " + hints);

        ExecutionAdapter adapter = adapters.get();
        ExecutionResult result = hinted ? adapter.runWithDirective(query, hints) : adapter.planAndAnalyze(query);
        if (!result.isSuccess()) {
            out.println("Error: " + result.getError());
            return Main.EXIT_FAILURE;
        }

        JSONObject executedPlan = result.getExecutionPlan();
        Map<String, Object> fields = result.toDisplayMap();
        if (executedPlan != null) {
            fields.put("extracted_hints", compiler.compile(executedPlan));
        }
        printResults(fields, "Execution Plan Analysis");

        if (verbose && executedPlan != null) {
            out.println("=== Detailed Execution Plan ===");
            out.println(executedPlan.toString(2));
            out.println();
            out.println("=== Execution Plan Tree ===");
            PlanParseResult parsed = PlanParser.parse(executedPlan);
            if (parsed.isParsed()) out.print(parsed.getRoot().render());
            out.println();
        }

        if (executedPlan != null) printHints(executedPlan, verbose);

        if (iterations > 1) {
            BenchmarkSummary summary = new QueryBenchmarker(adapter).benchmark(query, iterations);
            if (!summary.isSuccess()) {
                out.println("Benchmark error: " + summary.getError());
                return Main.EXIT_FAILURE;
            }
            printResults(summary.toDisplayMap(), "Benchmark Results (" + iterations + " iterations)");
        }
        return Main.EXIT_OK;
    }

    private void printHints(Object plan, boolean verbose) {
        out.println();
        out.println("=== Extracted pg_hint_plan Hints ===");
        if (verbose) {
            HintsCommand.printBreakdown(out, compiler.compileVerbose(PlanParser.parse(plan)), "Hint string: ");
        } else {
            out.println("Hints: " + compiler.compile(plan));
        }
        out.println();
    }

    void printResults(Map<String, Object> fields, String title) {
        out.println();
        out.println("=== " + title + " ===");
        for (Map.Entry<String, Object> e : fields.entrySet()) {
            String key = e.getKey();
            Object value = e.getValue();
            if ("execution_plan".equals(key)) {
                out.println(key + ": [JSON execution plan - use --verbose to see full plan]");
            } else if ("results".equals(key)) {
                out.println(key + ": " + value + " (showing first rows)");
            } else if (value instanceof Double d) {
                out.println(key + ": " + String.format(Locale.ROOT, "%.2f", d));
            } else {
                out.println(key + ": " + value);
            }
        }
        out.println();
    }
}
