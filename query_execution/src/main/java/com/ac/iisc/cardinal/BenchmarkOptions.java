package com.ac.iisc.cardinal;

/**
 * Settings for a batch run over a {@link QueryTable}.
 */
public final class BenchmarkOptions {

    public static final String DEFAULT_QUERY_COLUMN = "query";
    public static final String DEFAULT_PLAN_COLUMN = "plan_json";
    public static final String DEFAULT_OUTPUT_COLUMN = "execution_time";
    public static final int DEFAULT_WORKERS = 4;
    public static final int DEFAULT_ITERATIONS = 1;

    private boolean useHints;
    private int iterations = DEFAULT_ITERATIONS;
    private int workers = DEFAULT_WORKERS;
    private boolean verbose;
    private String queryColumn = DEFAULT_QUERY_COLUMN;
    private String planColumn = DEFAULT_PLAN_COLUMN;
    private String outputColumn = DEFAULT_OUTPUT_COLUMN;

    public boolean isUseHints() { return useHints; }
    public BenchmarkOptions setUseHints(boolean useHints) { this.useHints = useHints; return this; }
    public int getIterations() { return iterations; }
    public BenchmarkOptions setIterations(int iterations) { this.iterations = iterations; return this; }
    public int getWorkers() { return workers; }
    public BenchmarkOptions setWorkers(int workers) { this.workers = workers; return this; }
    public boolean isVerbose() { return verbose; }
    public BenchmarkOptions setVerbose(boolean verbose) { this.verbose = verbose; return this; }
    public String getQueryColumn() { return queryColumn; }
    public BenchmarkOptions setQueryColumn(String queryColumn) { this.queryColumn = queryColumn; return this; }
    public String getPlanColumn() { return planColumn; }
    public BenchmarkOptions setPlanColumn(String planColumn) { this.planColumn = planColumn; return this; }
    public String getOutputColumn() { return outputColumn; }
    public BenchmarkOptions setOutputColumn(String outputColumn) { this.outputColumn = outputColumn; return this; }

    @Override
    public String toString() {
        return "BenchmarkOptions[useHints=" + useHints + ", iterations=" + iterations + ", workers=" + workers + "]";
    }
}
