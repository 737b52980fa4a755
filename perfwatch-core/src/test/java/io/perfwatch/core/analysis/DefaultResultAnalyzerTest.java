package io.perfwatch.core.analysis;

import io.perfwatch.api.analysis.EmptyInputException;
import io.perfwatch.api.analysis.PerformanceReport;
import io.perfwatch.api.analysis.SampleBatch;
import io.perfwatch.api.analysis.SampleRecord;
import io.perfwatch.api.analysis.Verdict;
import io.perfwatch.api.analysis.VerdictThresholds;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DefaultResultAnalyzerTest {

    private static final long START = 1_700_000_000_000L;

    private final DefaultResultAnalyzer analyzer = new DefaultResultAnalyzer();

    // --- Verdicts ---

    @Test
    void shouldPassHealthyRun() {
        PerformanceReport report = analyzer.analyze(run(100, 96, 300));

        assertThat(report.totalCount()).isEqualTo(100);
        assertThat(report.successCount()).isEqualTo(96);
        assertThat(report.errorCount()).isEqualTo(4);
        assertThat(report.successRatePct()).isEqualTo(96.0);
        assertThat(report.errorRatePct()).isEqualTo(4.0);
        assertThat(report.avgResponseMs()).isEqualTo(300.0);
        assertThat(report.verdict()).isEqualTo(Verdict.PASS);
    }

    @Test
    void shouldMarkRunUnstableWhenBothMetricsAreInTheSecondBand() {
        PerformanceReport report = analyzer.analyze(run(100, 91, 1500));

        assertThat(report.successRatePct()).isEqualTo(91.0);
        assertThat(report.verdict()).isEqualTo(Verdict.UNSTABLE);
    }

    @Test
    void shouldFailRunWithLowSuccessRate() {
        PerformanceReport report = analyzer.analyze(run(100, 70, 300));

        assertThat(report.successRatePct()).isEqualTo(70.0);
        assertThat(report.verdict()).isEqualTo(Verdict.FAIL);
    }

    @Test
    void shouldNotPassPerfectButSlowRun() {
        assertThat(analyzer.analyze(run(100, 100, 1200)).verdict()).isEqualTo(Verdict.UNSTABLE);
        assertThat(analyzer.analyze(run(100, 100, 2500)).verdict()).isEqualTo(Verdict.FAIL);
    }

    @Test
    void shouldUseConfiguredThresholds() {
        var strict = new DefaultResultAnalyzer(new VerdictThresholds(99, 200, 97, 400));

        PerformanceReport report = strict.analyze(run(100, 96, 300));

        assertThat(report.verdict()).isEqualTo(Verdict.FAIL);
        assertThat(report.thresholds()).isEqualTo(strict.thresholds());
    }

    // --- Statistics ---

    @Test
    void shouldIncludeFailedSamplesInResponseTimes() {
        List<SampleRecord> records = List.of(
                new SampleRecord(START, 100, true),
                new SampleRecord(START + 500, 300, true),
                new SampleRecord(START + 1000, 5000, false),
                new SampleRecord(START + 2000, 40, true));

        PerformanceReport report = analyzer.analyze(records);

        assertThat(report.avgResponseMs()).isEqualTo(1360.0);
        assertThat(report.minResponseMs()).isEqualTo(40);
        assertThat(report.maxResponseMs()).isEqualTo(5000);
        assertThat(report.durationSec()).isEqualTo(2.0);
        assertThat(report.throughputRps()).isEqualTo(2.0);
        assertThat(report.successRatePct()).isEqualTo(75.0);
        assertThat(report.errorRatePct()).isEqualTo(25.0);
    }

    @Test
    void shouldComputeThroughputFromFirstAndLastTimestamps() {
        PerformanceReport report = analyzer.analyze(run(100, 100, 50));

        // 100 samples, 100 ms apart: 9.9 s
        assertThat(report.durationSec()).isCloseTo(9.9, within(1e-9));
        assertThat(report.throughputRps()).isCloseTo(100 / 9.9, within(1e-9));
        assertThat(report.degenerateDuration()).isFalse();
    }

    @Test
    void shouldReportZeroThroughputForOutOfOrderTimestamps() {
        List<SampleRecord> records = List.of(
                new SampleRecord(START + 5000, 100, true),
                new SampleRecord(START + 1000, 100, true),
                new SampleRecord(START, 100, true));

        PerformanceReport report = analyzer.analyze(records);

        assertThat(report.durationSec()).isEqualTo(0.0);
        assertThat(report.throughputRps()).isEqualTo(0.0);
        assertThat(report.throughputRps()).isNotNaN();
        assertThat(report.degenerateDuration()).isTrue();
    }

    @Test
    void shouldReportZeroThroughputForSingleSample() {
        PerformanceReport report = analyzer.analyze(List.of(new SampleRecord(START, 120, true)));

        assertThat(report.durationSec()).isEqualTo(0.0);
        assertThat(report.throughputRps()).isEqualTo(0.0);
        assertThat(report.avgResponseMs()).isEqualTo(120.0);
        assertThat(report.minResponseMs()).isEqualTo(120);
        assertThat(report.maxResponseMs()).isEqualTo(120);
    }

    // --- Empty and malformed input ---

    @Test
    void shouldRejectEmptyInput() {
        assertThatThrownBy(() -> analyzer.analyze(List.of()))
                .isInstanceOf(EmptyInputException.class);
    }

    @Test
    void shouldRejectBatchWithOnlyMalformedRows() {
        assertThatThrownBy(() -> analyzer.analyze(new SampleBatch(List.of(), 7)))
                .isInstanceOf(EmptyInputException.class)
                .hasMessageContaining("7 malformed")
                .satisfies(e -> assertThat(((EmptyInputException) e).malformedCount()).isEqualTo(7));
    }

    @Test
    void shouldCarryMalformedCountWithoutChangingTallies() {
        PerformanceReport report = analyzer.analyze(new SampleBatch(run(100, 96, 300), 3));

        assertThat(report.malformedCount()).isEqualTo(3);
        assertThat(report.hasMalformedSamples()).isTrue();
        assertThat(report.totalCount()).isEqualTo(100);
        assertThat(report.successCount() + report.errorCount()).isEqualTo(100);
        assertThat(report.verdict()).isEqualTo(Verdict.PASS);
    }

    // --- Purity ---

    @Test
    void shouldBeIdempotent() {
        List<SampleRecord> records = run(250, 231, 640);

        PerformanceReport first = analyzer.analyze(records);
        PerformanceReport second = analyzer.analyze(records);
        PerformanceReport third = new DefaultResultAnalyzer().analyze(List.copyOf(records));

        assertThat(second).isEqualTo(first);
        assertThat(third).isEqualTo(first);
    }

    // --- Helpers ---

    /**
     * {@code total} samples 100 ms apart, the first {@code successes} successful, every sample
     * taking {@code elapsedMs}.
     */
    private static List<SampleRecord> run(int total, int successes, long elapsedMs) {
        List<SampleRecord> records = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            records.add(new SampleRecord(START + i * 100L, elapsedMs, i < successes));
        }
        return records;
    }
}
