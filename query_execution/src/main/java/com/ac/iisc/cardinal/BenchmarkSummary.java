package com.ac.iisc.cardinal;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Statistics over repeated executions of one query, or the error that stopped them.
 */
public final class BenchmarkSummary {
    private final String query;
    private final int iterations;
    private final List<Double> allTimes;
    private final Double avgTimeMs;
    private final Double minTimeMs;
    private final Double maxTimeMs;
    private final String error;

    private BenchmarkSummary(String query, int iterations, List<Double> allTimes, String error) {
        this.query = query;
        this.iterations = iterations;
        this.error = error;
        if (allTimes == null || allTimes.isEmpty()) {
            this.allTimes = List.of();
            this.avgTimeMs = null;
            this.minTimeMs = null;
            this.maxTimeMs = null;
        } else {
            this.allTimes = List.copyOf(allTimes);
            double sum = 0;
            double min = Double.MAX_VALUE;
            double max = -Double.MAX_VALUE;
            for (double t : allTimes) {
                sum += t;
                min = Math.min(min, t);
                max = Math.max(max, t);
            }
            this.avgTimeMs = sum / allTimes.size();
            this.minTimeMs = min;
            this.maxTimeMs = max;
        }
    }

    static BenchmarkSummary of(String query, List<Double> times) {
        if (times == null || times.isEmpty()) return failure(query, "No successful executions");
        return new BenchmarkSummary(query, times.size(), times, null);
    }

    static BenchmarkSummary failure(String query, String error) {
        return new BenchmarkSummary(query, 0, null, error == null ? "unknown error" : error);
    }

    public boolean isSuccess() { return error == null; }
    public String getError() { return error; }
    public String getQuery() { return query; }
    public int getIterations() { return iterations; }
    public List<Double> getAllTimes() { return allTimes; }

    /** Arithmetic mean of all iterations (unrounded); null on failure. */
    public Double getAvgTimeMs() { return avgTimeMs; }
    public Double getMinTimeMs() { return minTimeMs; }
    public Double getMaxTimeMs() { return maxTimeMs; }

    /** Fields in the order the CLI prints them; the average is rounded to 2 decimals. */
    public Map<String, Object> toDisplayMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("query", query);
        if (!isSuccess()) {
            m.put("error", error);
            return m;
        }
        m.put("iterations", iterations);
        m.put("avg_time_ms", PostgresExecutionAdapter.round2(avgTimeMs));
        m.put("min_time_ms", minTimeMs);
        m.put("max_time_ms", maxTimeMs);
        m.put("all_times", allTimes);
        return m;
    }

    @Override
    public String toString() {
        return isSuccess() ? "BenchmarkSummary[" + iterations + " runs, avg=" + avgTimeMs + "ms]"
                           : "BenchmarkSummary[error=" + error + "]";
    }
}
