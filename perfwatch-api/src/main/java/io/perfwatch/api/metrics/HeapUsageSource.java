package io.perfwatch.api.metrics;

/**
 * Supplies the current heap usage as a ratio of used to available heap.
 * Read on every scrape.
 */
@FunctionalInterface
public interface HeapUsageSource {

    double heapUsageRatio();
}
