package io.perfwatch.api.metrics;

import java.util.Arrays;

/**
 * Configuration for the live request collector.
 * Controls histogram bucket boundaries, runtime meters and the cardinality warning.
 */
public final class CollectorConfig {

    public static final double[] DEFAULT_DURATION_BUCKETS_MS = {50, 100, 200, 400, 800, 1600, 3200};

    private double[] durationBucketsMs = DEFAULT_DURATION_BUCKETS_MS.clone();
    private boolean bindJvmMetrics = true;
    private int maxSeriesWarning = 1000;
    private HeapUsageSource heapUsageSource = null; // null = JVM heap

    private CollectorConfig() {}

    public static CollectorConfig create() {
        return new CollectorConfig();
    }

    /**
     * Upper bounds of the duration histogram in milliseconds. Must be strictly increasing.
     */
    public CollectorConfig durationBucketsMs(double... bounds) {
        if (bounds == null || bounds.length == 0) {
            throw new IllegalArgumentException("At least one bucket boundary is required");
        }
        for (int i = 0; i < bounds.length; i++) {
            if (bounds[i] <= 0 || Double.isNaN(bounds[i]) || Double.isInfinite(bounds[i])) {
                throw new IllegalArgumentException("Bucket boundaries must be positive and finite: " + bounds[i]);
            }
            if (i > 0 && bounds[i] <= bounds[i - 1]) {
                throw new IllegalArgumentException("Bucket boundaries must be strictly increasing: "
                        + Arrays.toString(bounds));
            }
        }
        this.durationBucketsMs = bounds.clone();
        return this;
    }

    /**
     * Register JVM memory, GC, thread, class loader, processor and uptime meters alongside
     * the request meters.
     */
    public CollectorConfig bindJvmMetrics(boolean bindJvmMetrics) {
        this.bindJvmMetrics = bindJvmMetrics;
        return this;
    }

    /**
     * Number of distinct duration series after which a cardinality warning is logged.
     */
    public CollectorConfig maxSeriesWarning(int maxSeriesWarning) {
        if (maxSeriesWarning <= 0) {
            throw new IllegalArgumentException("Series warning threshold must be positive");
        }
        this.maxSeriesWarning = maxSeriesWarning;
        return this;
    }

    public CollectorConfig heapUsageSource(HeapUsageSource heapUsageSource) {
        this.heapUsageSource = heapUsageSource;
        return this;
    }

    public double[] durationBucketsMs() { return durationBucketsMs.clone(); }
    public boolean bindJvmMetrics() { return bindJvmMetrics; }
    public int maxSeriesWarning() { return maxSeriesWarning; }
    public HeapUsageSource heapUsageSource() { return heapUsageSource; }
}
