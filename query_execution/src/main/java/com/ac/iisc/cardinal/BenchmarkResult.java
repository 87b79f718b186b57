package com.ac.iisc.cardinal;

/**
 * Timing or error for one row. Exactly one of the two is set.
 */
public final class BenchmarkResult {
    private final int rowIndex;
    private final Double executionTimeMs;
    private final String error;

    private BenchmarkResult(int rowIndex, Double executionTimeMs, String error) {
        this.rowIndex = rowIndex;
        this.executionTimeMs = executionTimeMs;
        this.error = error;
    }

    public static BenchmarkResult success(int rowIndex, double executionTimeMs) {
        return new BenchmarkResult(rowIndex, executionTimeMs, null);
    }

    public static BenchmarkResult failure(int rowIndex, String error) {
        return new BenchmarkResult(rowIndex, null, error == null || error.isBlank() ? "unknown error" : error);
    }

    public int getRowIndex() { return rowIndex; }
    public Double getExecutionTimeMs() { return executionTimeMs; }
    public String getError() { return error; }
    public boolean isSuccess() { return error == null; }

    @Override
    public String toString() {
        return isSuccess() ? "row " + rowIndex + ": " + executionTimeMs + "ms"
                           : "row " + rowIndex + ": ERROR " + error;
    }
}
