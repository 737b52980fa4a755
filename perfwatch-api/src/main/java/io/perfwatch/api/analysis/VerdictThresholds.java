package io.perfwatch.api.analysis;

/**
 * Nested thresholds for the run verdict.
 * <p>
 * A run is {@link Verdict#PASS} when both the success rate and the average response time are
 * inside the pass band, {@link Verdict#UNSTABLE} when both are at least inside the unstable band,
 * and {@link Verdict#FAIL} otherwise. The per-metric {@link Rating}s used by report renderers come
 * from the same bands, so the two can never disagree.
 *
 * @param passMinSuccessRatePct     minimum success rate (percent) for PASS
 * @param passMaxAvgResponseMs      maximum average response time for PASS
 * @param unstableMinSuccessRatePct minimum success rate (percent) for UNSTABLE
 * @param unstableMaxAvgResponseMs  maximum average response time for UNSTABLE
 */
public record VerdictThresholds(
        double passMinSuccessRatePct,
        double passMaxAvgResponseMs,
        double unstableMinSuccessRatePct,
        double unstableMaxAvgResponseMs
) {

    private static final VerdictThresholds DEFAULTS = new VerdictThresholds(95, 1000, 90, 2000);

    public VerdictThresholds {
        if (!Double.isFinite(passMinSuccessRatePct) || !Double.isFinite(passMaxAvgResponseMs)
                || !Double.isFinite(unstableMinSuccessRatePct) || !Double.isFinite(unstableMaxAvgResponseMs)) {
            throw new IllegalArgumentException("Thresholds must be finite numbers");
        }
        if (passMinSuccessRatePct < 0 || passMinSuccessRatePct > 100
                || unstableMinSuccessRatePct < 0 || unstableMinSuccessRatePct > 100) {
            throw new IllegalArgumentException("Success rate thresholds must be between 0 and 100");
        }
        if (passMaxAvgResponseMs < 0 || unstableMaxAvgResponseMs < 0) {
            throw new IllegalArgumentException("Response time thresholds must not be negative");
        }
        if (unstableMinSuccessRatePct > passMinSuccessRatePct) {
            throw new IllegalArgumentException("Unstable success rate threshold must not exceed the pass threshold");
        }
        if (unstableMaxAvgResponseMs < passMaxAvgResponseMs) {
            throw new IllegalArgumentException("Unstable response time threshold must not be below the pass threshold");
        }
    }

    public static VerdictThresholds defaults() {
        return DEFAULTS;
    }

    public Rating rateSuccess(double successRatePct) {
        if (successRatePct >= passMinSuccessRatePct) return Rating.GOOD;
        if (successRatePct >= unstableMinSuccessRatePct) return Rating.WARN;
        return Rating.BAD;
    }

    public Rating rateResponseTime(double avgResponseMs) {
        if (avgResponseMs <= passMaxAvgResponseMs) return Rating.GOOD;
        if (avgResponseMs <= unstableMaxAvgResponseMs) return Rating.WARN;
        return Rating.BAD;
    }

    /**
     * Strict AND per tier, evaluated in precedence order.
     */
    public Verdict classify(double successRatePct, double avgResponseMs) {
        Rating success = rateSuccess(successRatePct);
        Rating latency = rateResponseTime(avgResponseMs);
        if (success == Rating.GOOD && latency == Rating.GOOD) {
            return Verdict.PASS;
        }
        if (success.atLeast(Rating.WARN) && latency.atLeast(Rating.WARN)) {
            return Verdict.UNSTABLE;
        }
        return Verdict.FAIL;
    }
}
