package com.ac.iisc.cardinal;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.function.Supplier;

/**
 * Command-line entry point.
 *
 * Commands:
 * - hints: print the pg_hint_plan directive for an EXPLAIN (FORMAT JSON) plan.
 * - query: run one query (hinted or analyzed), print its plan figures and benchmark it.
 * - batch: benchmark every query of a CSV file on a worker pool and write the timings.
 *
 * Exit codes: 0 success, 1 runtime or usage error, 2 unrecognized argument.
 */
public class Main
{
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = """
        Usage: cardinal <command> [options]

        Commands:
          hints [PLAN_JSON] [-f|--file FILE] [--stdin] [-v|--verbose] [--test]
              Convert an EXPLAIN (FORMAT JSON) plan into pg_hint_plan hints.
          query -q|--query SQL [--hints H] [-i|--iterations N] [-v|--verbose]
                [--plan-to-hints JSON] [--plan-file FILE]
              Execute a single query and benchmark it (iterations 1..20, default 3).
          batch CSV [-o|--output OUT] [--use-hints] [-i|--iterations N] [-w|--workers N] [-v|--verbose]
              Benchmark every query in a CSV file (default 1 iteration, 4 workers).

        Connection settings come from config.properties and the POSTGRES_HOST, POSTGRES_PORT,
        POSTGRES_DB, POSTGRES_USER and POSTGRES_PASSWORD environment variables.
        """;

    private final Supplier<ExecutionAdapter> adapters;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    Main(Supplier<ExecutionAdapter> adapters, InputStream in, PrintStream out, PrintStream err)
    {
        this.adapters = adapters;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args)
    {
        Main main = new Main(() -> new PostgresExecutionAdapter(DatabaseConfig.load()), System.in, System.out, System.err);
        System.exit(main.run(args));
    }

    /**
     * Dispatch to a command and translate its outcome into an exit code.
     */
    int run(String[] args)
    {
        if (args.length == 0)
        {
            err.print(USAGE);
            return EXIT_FAILURE;
        }
        if ("-h".equals(args[0]) || "--help".equals(args[0]))
        {
            out.print(USAGE);
            return EXIT_OK;
        }

        String[] rest = Arrays.copyOfRange(args, 1, args.length);
        try
        {
            return switch (args[0]) {
                case "hints" -> new HintsCommand(in, out).run(rest);
                case "query" -> new SingleQueryCommand(adapters, out).run(rest);
                case "batch" -> new BatchCommand(adapters, out).run(rest);
                default -> throw CliException.usage("Unknown command: " + args[0]);
            };
        }
        catch (CliException e)
        {
            err.println("Error: " + e.getMessage());
            if (e.getExitCode() == EXIT_USAGE)
                err.print(USAGE);
            return e.getExitCode();
        }
        catch (IOException | BenchmarkConfigurationException e)
        {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            err.println("Interrupted");
            return EXIT_FAILURE;
        }
    }

    /** Value following option {@code args[i]}; fails when the option is last. */
    static String optionValue(String[] args, int i) throws CliException
    {
        if (i + 1 >= args.length)
            throw CliException.failure("missing value for " + args[i]);
        return args[i + 1];
    }

    static int intOption(String[] args, int i) throws CliException
    {
        String raw = optionValue(args, i);
        try
        {
            return Integer.parseInt(raw.trim());
        }
        catch (NumberFormatException e)
        {
            throw CliException.failure("invalid integer for " + args[i] + ": " + raw);
        }
    }
}
