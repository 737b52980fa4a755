package io.perfwatch.core.metrics;

import io.perfwatch.api.metrics.HeapUsageSource;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;

/**
 * Heap used divided by heap committed, read from the platform memory bean.
 */
public class JvmHeapUsage implements HeapUsageSource {

    private final MemoryMXBean memoryBean;

    public JvmHeapUsage() {
        this(ManagementFactory.getMemoryMXBean());
    }

    JvmHeapUsage(MemoryMXBean memoryBean) {
        this.memoryBean = memoryBean;
    }

    @Override
    public double heapUsageRatio() {
        MemoryUsage heap = memoryBean.getHeapMemoryUsage();
        return heap.getCommitted() > 0 ? (double) heap.getUsed() / heap.getCommitted() : 0.0;
    }
}
