package com.ac.iisc.cardinal;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * {@code batch} command: benchmark every row of a CSV file and write the timings next to it.
 */
class BatchCommand {

    private final Supplier<ExecutionAdapter> adapters;
    private final PrintStream out;

    BatchCommand(Supplier<ExecutionAdapter> adapters, PrintStream out) {
        this.adapters = adapters;
        this.out = out;
    }

    int run(String[] args) throws CliException, IOException, InterruptedException {
        String input = null;
        String output = null;
        BenchmarkOptions options = new BenchmarkOptions();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-o", "--output" -> output = Main.optionValue(args, i++);
                case "--use-hints" -> options.setUseHints(true);
                case "-i", "--iterations" -> options.setIterations(Main.intOption(args, i++));
                case "-w", "--workers" -> options.setWorkers(Main.intOption(args, i++));
                case "-v", "--verbose" -> options.setVerbose(true);
                default -> {
                    if (arg.startsWith("-") || input != null) {
                        throw CliException.usage("unrecognized argument: " + HintsCommand.abbreviate(arg));
                    }
                    input = arg;
                }
            }
        }
        if (input == null) throw CliException.failure("an input CSV file is required");

        Path inputPath = Path.of(input);
        if (!Files.isRegularFile(inputPath)) throw CliException.failure("Input file not found: " + input);
        Path outputPath = Path.of(output != null ? output : FileIO.defaultOutputPath(input));

        QueryTable table = QueryTable.read(inputPath);
        out.println("Loaded " + table.size() + " queries from " + input);

        BenchmarkOrchestrator orchestrator = new BenchmarkOrchestrator(adapters.get(), options.getWorkers(), options.isVerbose());
        QueryTable result = orchestrator.runTable(table, options);
        result.write(outputPath);

        int failed = 0;
        for (int r = 0; r < result.size(); r++) {
            String t = result.get(r, options.getOutputColumn());
            if (t == null || t.isEmpty()) failed++;
        }
        out.println("Processed " + result.size() + " queries (" + failed + " failed)");
        out.println("Results written to " + outputPath);
        return Main.EXIT_OK;
    }
}
