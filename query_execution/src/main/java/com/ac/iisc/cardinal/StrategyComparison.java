package com.ac.iisc.cardinal;

import java.util.List;

/**
 * Result of running one query under the default plan and under several hint directives.
 * Strategies that failed are left out of {@link #getResults()}.
 */
public final class StrategyComparison {

    /** One strategy that ran successfully. */
    public static final class Outcome {
        private final String strategy;
        private final String hints;
        private final double executionTime;
        private final Double rows;

        Outcome(String strategy, String hints, double executionTime, Double rows) {
            this.strategy = strategy;
            this.hints = hints;
            this.executionTime = executionTime;
            this.rows = rows;
        }

        /** {@code default}, or {@code hint_1}, {@code hint_2}, ... in input order. */
        public String getStrategy() { return strategy; }

        /** Directive used; null for the default strategy. */
        public String getHints() { return hints; }
        public double getExecutionTime() { return executionTime; }
        public Double getRows() { return rows; }

        @Override
        public String toString() {
            return strategy + " (" + executionTime + "ms)";
        }
    }

    private final String query;
    private final List<Outcome> results;

    StrategyComparison(String query, List<Outcome> results) {
        this.query = query;
        this.results = List.copyOf(results);
    }

    public String getQuery() { return query; }
    public List<Outcome> getResults() { return results; }
    public int getStrategiesTested() { return results.size(); }

    /** Fastest successful strategy (first one on ties), or null when none succeeded. */
    public Outcome getBestStrategy() {
        Outcome best = null;
        for (Outcome o : results) {
            if (best == null || o.getExecutionTime() < best.getExecutionTime()) best = o;
        }
        return best;
    }
}
