package com.ac.iisc.cardinal;

/**
 * A command could not run; carries the process exit code to report.
 */
class CliException extends Exception {

    private final int exitCode;

    CliException(int exitCode, String message) {
        super(message);
        this.exitCode = exitCode;
    }

    static CliException usage(String message) {
        return new CliException(Main.EXIT_USAGE, message);
    }

    static CliException failure(String message) {
        return new CliException(Main.EXIT_FAILURE, message);
    }

    int getExitCode() {
        return exitCode;
    }
}
