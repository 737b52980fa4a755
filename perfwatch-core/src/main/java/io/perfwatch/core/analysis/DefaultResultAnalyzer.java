package io.perfwatch.core.analysis;

import io.perfwatch.api.analysis.EmptyInputException;
import io.perfwatch.api.analysis.PerformanceReport;
import io.perfwatch.api.analysis.ResultAnalyzer;
import io.perfwatch.api.analysis.SampleBatch;
import io.perfwatch.api.analysis.SampleRecord;
import io.perfwatch.api.analysis.Verdict;
import io.perfwatch.api.analysis.VerdictThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Single-pass analyzer over a finished run's samples.
 * <p>
 * Failed samples count towards the response time statistics: they still consumed time.
 * The run duration is the span between the first and the last sample's timestamp; when the
 * samples are out of order and that span is negative it is clamped to zero and throughput is
 * reported as zero.
 */
public class DefaultResultAnalyzer implements ResultAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(DefaultResultAnalyzer.class);

    private final VerdictThresholds thresholds;

    public DefaultResultAnalyzer() {
        this(VerdictThresholds.defaults());
    }

    public DefaultResultAnalyzer(VerdictThresholds thresholds) {
        if (thresholds == null) {
            throw new IllegalArgumentException("Thresholds are required");
        }
        this.thresholds = thresholds;
    }

    @Override
    public PerformanceReport analyze(List<SampleRecord> records) {
        return analyze(records, 0);
    }

    @Override
    public PerformanceReport analyze(SampleBatch batch) {
        return analyze(batch.records(), batch.malformedCount());
    }

    public VerdictThresholds thresholds() {
        return thresholds;
    }

    private PerformanceReport analyze(List<SampleRecord> records, int malformedCount) {
        if (records == null || records.isEmpty()) {
            throw new EmptyInputException(malformedCount > 0
                    ? "No valid samples to analyze (" + malformedCount + " malformed)"
                    : "No samples to analyze", malformedCount);
        }

        long total = records.size();
        long success = 0;
        long elapsedSum = 0;
        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;

        for (SampleRecord record : records) {
            if (record.success()) {
                success++;
            }
            elapsedSum += record.elapsedMs();
            min = Math.min(min, record.elapsedMs());
            max = Math.max(max, record.elapsedMs());
        }

        double successRate = success * 100.0 / total;
        double errorRate = 100.0 - successRate;
        double avg = (double) elapsedSum / total;

        long spanMs = records.get(records.size() - 1).timestampMs() - records.get(0).timestampMs();
        if (spanMs < 0) {
            log.warn("Samples are not ordered by timestamp (last - first = {} ms); throughput reported as 0", spanMs);
        }
        double durationSec = Math.max(0, spanMs) / 1000.0;
        double throughput = durationSec > 0 ? total / durationSec : 0.0;

        Verdict verdict = thresholds.classify(successRate, avg);

        return new PerformanceReport(
                total,
                success,
                total - success,
                malformedCount,
                successRate,
                errorRate,
                avg,
                min,
                max,
                durationSec,
                throughput,
                verdict,
                thresholds);
    }
}
