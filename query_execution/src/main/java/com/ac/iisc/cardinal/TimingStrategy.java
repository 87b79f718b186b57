package com.ac.iisc.cardinal;

/**
 * How a benchmark task is timed, chosen from whether a hint directive is available
 * and how many iterations were requested.
 */
public enum TimingStrategy {
    /** One hinted EXPLAIN ANALYZE; timing from {@link ExecutionResult#resolveTiming()}. */
    SINGLE_HINTED,
    /** One plain execution; elapsed wall time. */
    SINGLE_PLAIN,
    /** Mean of the resolved timing over N hinted runs. */
    AVERAGE_HINTED,
    /** Mean wall time over N plain runs, rounded to 2 decimals. */
    AVERAGE_PLAIN;

    public static TimingStrategy select(boolean hasDirective, int iterations) {
        if (iterations < 1) throw new IllegalArgumentException("iterations must be >= 1, got " + iterations);
        if (iterations == 1) return hasDirective ? SINGLE_HINTED : SINGLE_PLAIN;
        return hasDirective ? AVERAGE_HINTED : AVERAGE_PLAIN;
    }

    public boolean isHinted() {
        return this == SINGLE_HINTED || this == AVERAGE_HINTED;
    }
}
