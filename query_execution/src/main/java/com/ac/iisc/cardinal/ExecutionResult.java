package com.ac.iisc.cardinal;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.json.JSONObject;

/**
 * Outcome of one {@link ExecutionAdapter} call: either a success payload or an error
 * marker, never both.
 *
 * Which payload fields are set depends on the operation:
 * - planOnly: executionPlan, estimatedCost, estimatedRows, planningTime, explainTimeMs
 * - planAndAnalyze / runWithDirective: executionPlan, actualTotalTime, actualRows,
 *   planningTime, executionTime, explainTimeMs (plus hints for runWithDirective)
 * - run: executionTimeMs, rowCount, sampleRows
 *
 * Unset numeric fields are null, not zero.
 */
public final class ExecutionResult {

    private final String query;
    private final String error;

    private final JSONObject executionPlan;
    private final boolean analyzed;
    private final Double explainTimeMs;
    private final Double planningTime;
    private final Double executionTime;
    private final Double actualTotalTime;
    private final Double actualRows;
    private final Double estimatedCost;
    private final Double estimatedRows;
    private final Double executionTimeMs;
    private final Integer rowCount;
    private final List<List<Object>> sampleRows;
    private final String hints;

    private ExecutionResult(Builder b) {
        this.query = b.query;
        this.error = null;
        this.executionPlan = b.executionPlan;
        this.analyzed = b.analyzed;
        this.explainTimeMs = b.explainTimeMs;
        this.planningTime = b.planningTime;
        this.executionTime = b.executionTime;
        this.actualTotalTime = b.actualTotalTime;
        this.actualRows = b.actualRows;
        this.estimatedCost = b.estimatedCost;
        this.estimatedRows = b.estimatedRows;
        this.executionTimeMs = b.executionTimeMs;
        this.rowCount = b.rowCount;
        this.sampleRows = b.sampleRows == null ? null : List.copyOf(b.sampleRows);
        this.hints = b.hints;
    }

    private ExecutionResult(String query, String error, String hints) {
        this.query = query;
        this.error = error;
        this.executionPlan = null;
        this.analyzed = false;
        this.explainTimeMs = null;
        this.planningTime = null;
        this.executionTime = null;
        this.actualTotalTime = null;
        this.actualRows = null;
        this.estimatedCost = null;
        this.estimatedRows = null;
        this.executionTimeMs = null;
        this.rowCount = null;
        this.sampleRows = null;
        this.hints = hints;
    }

    public static Builder success(String query) {
        return new Builder(query);
    }

    public static ExecutionResult failure(String query, String error) {
        return failure(query, error, null);
    }

    public static ExecutionResult failure(String query, String error, String hints) {
        return new ExecutionResult(query, error == null || error.isBlank() ? "unknown error" : error, hints);
    }

    public boolean isSuccess() { return error == null; }

    public String getError() { return error; }
    public String getQuery() { return query; }
    public JSONObject getExecutionPlan() { return executionPlan; }
    public boolean isAnalyzed() { return analyzed; }
    public Double getExplainTimeMs() { return explainTimeMs; }
    public Double getPlanningTime() { return planningTime; }
    public Double getExecutionTime() { return executionTime; }
    public Double getActualTotalTime() { return actualTotalTime; }
    public Double getActualRows() { return actualRows; }
    public Double getEstimatedCost() { return estimatedCost; }
    public Double getEstimatedRows() { return estimatedRows; }
    public Double getExecutionTimeMs() { return executionTimeMs; }
    public Integer getRowCount() { return rowCount; }
    public List<List<Object>> getSampleRows() { return sampleRows; }
    public String getHints() { return hints; }

    /**
     * The timing a benchmark should record for this result: the first non-null of
     * actual total time, EXPLAIN execution time, and measured wall time.
     *
     * @return milliseconds, or null when the result carries none of them
     */
    public Double resolveTiming() {
        if (actualTotalTime != null) return actualTotalTime;
        if (executionTime != null) return executionTime;
        return executionTimeMs;
    }

    /**
     * Fields in display order, keyed the way the CLI prints them. Only set fields are
     * included; a failed result shows query and error.
     */
    public Map<String, Object> toDisplayMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("query", query);
        if (!isSuccess()) {
            if (hints != null) m.put("hints", hints);
            m.put("error", error);
            return m;
        }
        if (hints != null) m.put("hints", hints);
        if (executionPlan != null) {
            m.put("execution_plan", executionPlan);
            m.put("analyzed", analyzed);
        }
        putIfSet(m, "explain_time_ms", explainTimeMs);
        putIfSet(m, "estimated_cost", estimatedCost);
        putIfSet(m, "estimated_rows", estimatedRows);
        putIfSet(m, "actual_total_time", actualTotalTime);
        putIfSet(m, "actual_rows", actualRows);
        putIfSet(m, "planning_time", planningTime);
        putIfSet(m, "execution_time", executionTime);
        putIfSet(m, "execution_time_ms", executionTimeMs);
        putIfSet(m, "row_count", rowCount);
        putIfSet(m, "results", sampleRows);
        return m;
    }

    private static void putIfSet(Map<String, Object> m, String key, Object value) {
        if (value != null) m.put(key, value);
    }

    @Override
    public String toString() {
        return isSuccess() ? "ExecutionResult[ok, timing=" + resolveTiming() + "]"
                           : "ExecutionResult[error=" + error + "]";
    }

    /** Collects the payload of a successful call. */
    public static final class Builder {
        private final String query;
        private JSONObject executionPlan;
        private boolean analyzed;
        private Double explainTimeMs;
        private Double planningTime;
        private Double executionTime;
        private Double actualTotalTime;
        private Double actualRows;
        private Double estimatedCost;
        private Double estimatedRows;
        private Double executionTimeMs;
        private Integer rowCount;
        private List<List<Object>> sampleRows;
        private String hints;

        private Builder(String query) {
            this.query = query;
        }

        public Builder executionPlan(JSONObject executionPlan) { this.executionPlan = executionPlan; return this; }
        public Builder analyzed(boolean analyzed) { this.analyzed = analyzed; return this; }
        public Builder explainTimeMs(Double explainTimeMs) { this.explainTimeMs = explainTimeMs; return this; }
        public Builder planningTime(Double planningTime) { this.planningTime = planningTime; return this; }
        public Builder executionTime(Double executionTime) { this.executionTime = executionTime; return this; }
        public Builder actualTotalTime(Double actualTotalTime) { this.actualTotalTime = actualTotalTime; return this; }
        public Builder actualRows(Double actualRows) { this.actualRows = actualRows; return this; }
        public Builder estimatedCost(Double estimatedCost) { this.estimatedCost = estimatedCost; return this; }
        public Builder estimatedRows(Double estimatedRows) { this.estimatedRows = estimatedRows; return this; }
        public Builder executionTimeMs(Double executionTimeMs) { this.executionTimeMs = executionTimeMs; return this; }
        public Builder rowCount(Integer rowCount) { this.rowCount = rowCount; return this; }
        public Builder hints(String hints) { this.hints = hints; return this; }

        public Builder sampleRows(List<List<Object>> sampleRows) {
            this.sampleRows = sampleRows == null ? null : new ArrayList<>(sampleRows);
            return this;
        }

        public ExecutionResult build() {
            return new ExecutionResult(this);
        }
    }
}
