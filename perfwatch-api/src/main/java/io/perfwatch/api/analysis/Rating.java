package io.perfwatch.api.analysis;

/**
 * Classification of a single metric against the verdict thresholds.
 * GOOD is within the PASS band, WARN within the UNSTABLE band, BAD outside both.
 */
public enum Rating {
    GOOD,
    WARN,
    BAD;

    public boolean atLeast(Rating other) {
        return ordinal() <= other.ordinal();
    }
}
