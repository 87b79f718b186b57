package com.ac.iisc.cardinal;

/**
 * A benchmark run was set up wrongly (missing SQL column, worker or iteration count
 * below one, duplicate row index). Thrown before any task is dispatched.
 */
public class BenchmarkConfigurationException extends RuntimeException {

    public BenchmarkConfigurationException(String message) {
        super(message);
    }
}
