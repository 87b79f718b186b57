package com.ac.iisc.cardinal;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.json.JSONException;
import org.json.JSONTokener;

/**
 * {@code hints} command: plan JSON in, directive out.
 *
 * The plan comes from the positional argument, a file, or stdin. With {@code --test},
 * or with no input at all, a built-in three-table plan is converted instead.
 */
class HintsCommand {

    /** EXPLAIN output of a votes/posts/users aggregate; compiles to three scans and two hash joins. */
    static final String SAMPLE_PLAN = """
        [{"Plan": {"Node Type": "Limit", "Total Cost": 51.67, "Plan Rows": 10,
          "Plans": [{"Node Type": "Sort", "Total Cost": 51.68, "Plan Rows": 17,
            "Plans": [{"Node Type": "Aggregate", "Strategy": "Sorted", "Total Cost": 51.29, "Plan Rows": 17,
              "Plans": [{"Node Type": "Sort", "Total Cost": 51.0, "Plan Rows": 17,
                "Plans": [{"Node Type": "Hash Join", "Join Type": "Right", "Total Cost": 50.61, "Plan Rows": 17,
                  "Hash Cond": "(v.postid = p.id)",
                  "Plans": [
                    {"Node Type": "Seq Scan", "Relation Name": "votes", "Alias": "v",
                     "Total Cost": 28.88, "Plan Rows": 8, "Filter": "(votetypeid = 8)"},
                    {"Node Type": "Hash", "Total Cost": 21.48, "Plan Rows": 17,
                     "Plans": [{"Node Type": "Hash Join", "Join Type": "Inner", "Total Cost": 21.48, "Plan Rows": 17,
                       "Hash Cond": "(p.owneruserid = u.id)",
                       "Plans": [
                         {"Node Type": "Seq Scan", "Relation Name": "posts", "Alias": "p",
                          "Total Cost": 10.5, "Plan Rows": 50},
                         {"Node Type": "Hash", "Total Cost": 10.62, "Plan Rows": 17,
                          "Plans": [{"Node Type": "Seq Scan", "Relation Name": "users", "Alias": "u",
                            "Total Cost": 10.62, "Plan Rows": 17, "Filter": "(reputation > 1000)"}]}
                       ]}]}
                  ]}]}]}]}]}}]
        """;

    private final InputStream in;
    private final PrintStream out;
    private final HintCompiler compiler = new HintCompiler();

    HintsCommand(InputStream in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    int run(String[] args) throws CliException, IOException {
        String planArg = null;
        String file = null;
        boolean stdin = false;
        boolean verbose = false;
        boolean test = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-f", "--file" -> file = Main.optionValue(args, i++);
                case "--stdin" -> stdin = true;
                case "-v", "--verbose" -> verbose = true;
                case "--test" -> test = true;
                default -> {
                    if (arg.startsWith("-") || planArg != null) {
                        throw CliException.usage("unrecognized argument: " + abbreviate(arg));
                    }
                    planArg = arg;
                }
            }
        }

        if (test || (planArg == null && file == null && !stdin)) {
            runSample();
            return Main.EXIT_OK;
        }

        Object plan;
        if (stdin) {
            plan = parseJson(new String(in.readAllBytes(), StandardCharsets.UTF_8), "Invalid JSON from stdin");
        } else if (file != null) {
            plan = parseJson(readPlanFile(file, "File not found: "), "Invalid JSON in file");
        } else {
            plan = parseJson(planArg, "Invalid JSON");
        }

        if (verbose) {
            printBreakdown(out, compiler.compileVerbose(PlanParser.parse(plan)), "Hint string: ");
        } else {
            out.println(compiler.compile(plan));
        }
        return Main.EXIT_OK;
    }

    private void runSample() {
        out.println("=== Plan to Hints Converter Test ===");
        out.println();
        out.println("Generated hints: " + compiler.compile(SAMPLE_PLAN));
        out.println();
        CompiledHints verbose = compiler.compileVerbose(PlanParser.parse(SAMPLE_PLAN));
        out.println("Verbose result:");
        out.println("  Hint string: " + verbose.getDirective());
        out.println("  Scan hints: " + verbose.getScanHints());
        out.println("  Join hints: " + verbose.getJoinHints());
        out.println("  Index hints: " + verbose.getIndexHints());
    }

    /** Directive line followed by the per-category token lists. */
    static void printBreakdown(PrintStream out, CompiledHints hints, String label) {
        out.println(label + hints.getDirective());
        out.println();
        out.println("Breakdown:");
        out.println("  Scan hints: " + hints.getScanHints());
        out.println("  Join hints: " + hints.getJoinHints());
        out.println("  Index hints: " + hints.getIndexHints());
    }

    /** Parse JSON text into an org.json value; syntax errors exit with status 1. */
    static Object parseJson(String text, String errorPrefix) throws CliException {
        try {
            Object value = new JSONTokener(text.trim()).nextValue();
            if (value instanceof String) {
                // JSONTokener accepts bare words as strings
                throw new JSONException("expected an object or array");
            }
            return value;
        } catch (JSONException e) {
            throw CliException.failure(errorPrefix + ": " + e.getMessage());
        }
    }

    static String readPlanFile(String file, String notFoundPrefix) throws CliException, IOException {
        if (!Files.isRegularFile(Path.of(file))) {
            throw CliException.failure(notFoundPrefix + file);
        }
        return FileIO.readTextFile(file);
    }

    static String abbreviate(String arg) {
        return arg.length() > 100 ? arg.substring(0, 100) + "..." : arg;
    }
}
