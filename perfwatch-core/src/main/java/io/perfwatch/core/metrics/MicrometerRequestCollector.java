package io.perfwatch.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.jvm.ClassLoaderMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.binder.system.UptimeMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.perfwatch.api.metrics.CollectorConfig;
import io.perfwatch.api.metrics.HeapUsageSource;
import io.perfwatch.api.metrics.RequestEvent;
import io.perfwatch.api.metrics.RequestMetricsCollector;
import io.perfwatch.api.metrics.RequestToken;
import io.prometheus.client.exporter.common.TextFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default request collector using Micrometer with a Prometheus registry.
 * <p>
 * Tracks in-flight requests in a gauge, records request durations into a fixed-bucket
 * histogram labelled by method, route and status code, and exposes heap usage as a ratio.
 * Each instance owns its registry; nothing is process global.
 */
public class MicrometerRequestCollector implements RequestMetricsCollector {

    private static final Logger log = LoggerFactory.getLogger(MicrometerRequestCollector.class);

    static final String DURATION_METRIC = "http.request.duration.ms";
    static final String ACTIVE_METRIC = "http.active.connections";
    static final String HEAP_METRIC = "process.heap.usage.ratio";
    static final String ERRORS_METRIC = "perfwatch.recording.errors";

    private final PrometheusMeterRegistry registry;
    private final double[] bucketsMs;
    private final int maxSeriesWarning;
    private final AtomicLong activeConnections = new AtomicLong();
    private final HeapUsageSource heapUsage;
    private final Map<SeriesKey, DistributionSummary> durationSummaries = new ConcurrentHashMap<>();
    private final AtomicBoolean cardinalityWarned = new AtomicBoolean();
    private final Counter recordingErrors;
    private JvmGcMetrics gcMetrics;

    public MicrometerRequestCollector() {
        this(CollectorConfig.create());
    }

    public MicrometerRequestCollector(CollectorConfig config) {
        this(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT), config);
    }

    public MicrometerRequestCollector(PrometheusMeterRegistry registry, CollectorConfig config) {
        this.registry = registry;
        this.bucketsMs = config.durationBucketsMs();
        this.maxSeriesWarning = config.maxSeriesWarning();
        this.heapUsage = config.heapUsageSource() != null ? config.heapUsageSource() : new JvmHeapUsage();

        Gauge.builder(ACTIVE_METRIC, activeConnections, AtomicLong::get)
                .description("Number of in-flight HTTP requests")
                .register(registry);

        Gauge.builder(HEAP_METRIC, heapUsage, HeapUsageSource::heapUsageRatio)
                .description("Heap usage as a ratio of available heap")
                .strongReference(true)
                .register(registry);

        recordingErrors = Counter.builder(ERRORS_METRIC)
                .description("Failures swallowed while recording request metrics")
                .register(registry);

        if (config.bindJvmMetrics()) {
            bindJvmMetrics();
        }
    }

    @Override
    public RequestToken onRequestStart() {
        RequestToken token = RequestToken.start();
        activeConnections.incrementAndGet();
        return token;
    }

    @Override
    public boolean onRequestTerminal(RequestToken token, String method, String route, int statusCode, long durationMs) {
        if (token == null || !token.tryFinalize()) {
            return false;
        }
        activeConnections.decrementAndGet();
        try {
            record(new RequestEvent(method, route, statusCode, Math.max(0, durationMs)));
        } catch (Exception e) {
            recordingErrors.increment();
            log.warn("Failed to record request metrics for {} {}", method, route, e);
        }
        return true;
    }

    @Override
    public String snapshot() {
        return registry.scrape();
    }

    @Override
    public String contentType() {
        return TextFormat.CONTENT_TYPE_004;
    }

    @Override
    public long activeConnections() {
        return activeConnections.get();
    }

    public PrometheusMeterRegistry registry() {
        return registry;
    }

    /**
     * @return number of distinct (method, route, status) duration series seen so far
     */
    public int seriesCount() {
        return durationSummaries.size();
    }

    @Override
    public void close() {
        if (gcMetrics != null) {
            gcMetrics.close();
        }
        registry.close();
        log.info("Request metrics collector closed");
    }

    void record(RequestEvent event) {
        durationSummary(event).record(event.durationMs());
    }

    private DistributionSummary durationSummary(RequestEvent event) {
        SeriesKey key = new SeriesKey(
                event.method() != null ? event.method() : "UNKNOWN",
                event.route() != null ? event.route() : "",
                event.statusCode());
        DistributionSummary summary = durationSummaries.get(key);
        if (summary != null) {
            return summary;
        }
        summary = durationSummaries.computeIfAbsent(key, k ->
                DistributionSummary.builder(DURATION_METRIC)
                        .description("Duration of HTTP requests in ms")
                        .tag("method", k.method())
                        .tag("route", k.route())
                        .tag("status_code", String.valueOf(k.statusCode()))
                        .serviceLevelObjectives(bucketsMs)
                        .register(registry));
        if (durationSummaries.size() > maxSeriesWarning && cardinalityWarned.compareAndSet(false, true)) {
            log.warn("Request duration histogram has more than {} series; unmatched literal paths "
                    + "are probably being used as route labels", maxSeriesWarning);
        }
        return summary;
    }

    private void bindJvmMetrics() {
        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ClassLoaderMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);
        new UptimeMetrics().bindTo(registry);
        gcMetrics = new JvmGcMetrics();
        gcMetrics.bindTo(registry);
    }

    private record SeriesKey(String method, String route, int statusCode) {}
}
