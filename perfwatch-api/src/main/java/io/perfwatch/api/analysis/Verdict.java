package io.perfwatch.api.analysis;

/**
 * Overall outcome of a load test run.
 */
public enum Verdict {
    PASS,
    UNSTABLE,
    FAIL
}
