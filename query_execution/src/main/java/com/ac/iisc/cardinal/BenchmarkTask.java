package com.ac.iisc.cardinal;

/**
 * One row of a benchmark run.
 *
 * The plan payload may be null, a JSON string, or an already parsed org.json value;
 * it only matters when {@code useHints} is set.
 */
public final class BenchmarkTask {
    private final int rowIndex;
    private final String queryText;
    private final Object planPayload;
    private final boolean useHints;
    private final int iterations;

    public BenchmarkTask(int rowIndex, String queryText, Object planPayload, boolean useHints, int iterations) {
        this.rowIndex = rowIndex;
        this.queryText = queryText;
        this.planPayload = planPayload;
        this.useHints = useHints;
        this.iterations = iterations;
    }

    public int getRowIndex() { return rowIndex; }
    public String getQueryText() { return queryText; }
    public Object getPlanPayload() { return planPayload; }
    public boolean isUseHints() { return useHints; }
    public int getIterations() { return iterations; }

    @Override
    public String toString() {
        return "BenchmarkTask[row=" + rowIndex + ", hints=" + useHints + ", iterations=" + iterations + "]";
    }
}
