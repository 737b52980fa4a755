package io.perfwatch.api.analysis;

/**
 * Summary of a load test run, derived once from its samples.
 */
public record PerformanceReport(
        long totalCount,
        long successCount,
        long errorCount,
        long malformedCount,
        double successRatePct,
        double errorRatePct,
        double avgResponseMs,
        long minResponseMs,
        long maxResponseMs,
        double durationSec,
        double throughputRps,
        Verdict verdict,
        VerdictThresholds thresholds
) {

    /**
     * @return {@code true} when the samples span no positive time interval, so throughput is
     * reported as zero
     */
    public boolean degenerateDuration() {
        return durationSec <= 0;
    }

    public boolean hasMalformedSamples() {
        return malformedCount > 0;
    }

    public Rating successRating() {
        return thresholds.rateSuccess(successRatePct);
    }

    public Rating responseTimeRating() {
        return thresholds.rateResponseTime(avgResponseMs);
    }
}
