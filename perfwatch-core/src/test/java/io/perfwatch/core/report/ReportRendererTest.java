package io.perfwatch.core.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.perfwatch.api.analysis.PerformanceReport;
import io.perfwatch.api.analysis.Verdict;
import io.perfwatch.api.analysis.VerdictThresholds;
import io.perfwatch.api.report.ReportRenderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ReportRendererTest {

    @TempDir
    Path tempDir;

    // --- HTML ---

    @Test
    void shouldRenderHtmlWithVerdictBadge() {
        String html = new HtmlReportRenderer().render(passingReport());

        assertThat(html).startsWith("<!DOCTYPE html>");
        assertThat(html).contains("<title>Perfwatch Performance Report</title>");
        assertThat(html).contains("<span id=\"verdict\" class=\"badge badge-pass\">PASS</span>");
        assertThat(html).contains("96.00%");
        assertThat(html).contains("300.0 ms");
        assertThat(html).contains("Generated by Perfwatch");
        assertThat(html).doesNotContain("malformed-notice");
        assertThat(html).doesNotContain("duration-notice");
    }

    @Test
    void shouldColourMetricsFromTheSameBandsAsTheVerdict() {
        String passing = new HtmlReportRenderer().render(passingReport());
        assertThat(passing).contains("id=\"success-rate\" class=\"card-val pass\"");
        assertThat(passing).contains("id=\"avg-response\" class=\"card-val pass\"");

        String unstable = new HtmlReportRenderer().render(report(100, 91, 1500.0, 0, 10.0));
        assertThat(unstable).contains("badge-unstable");
        assertThat(unstable).contains("id=\"success-rate\" class=\"card-val warn\"");
        assertThat(unstable).contains("id=\"avg-response\" class=\"card-val warn\"");

        // perfect success rate, but too slow
        String slow = new HtmlReportRenderer().render(report(100, 100, 2500.0, 0, 10.0));
        assertThat(slow).contains("badge-fail");
        assertThat(slow).contains("id=\"success-rate\" class=\"card-val pass\"");
        assertThat(slow).contains("id=\"avg-response\" class=\"card-val fail\"");
    }

    @Test
    void shouldShowNoticesForMalformedRowsAndDegenerateDuration() {
        String html = new HtmlReportRenderer().render(report(100, 96, 300.0, 12, 0.0));

        assertThat(html).contains("id=\"malformed-notice\"");
        assertThat(html).contains("12 malformed sample rows were skipped");
        assertThat(html).contains("id=\"duration-notice\"");
        assertThat(html).contains("0.00 rps");
    }

    @Test
    void shouldShowThresholdBands() {
        PerformanceReport report = report(VerdictThresholds.defaults(), 100, 96, 300.0, 0, 10.0);

        String html = new HtmlReportRenderer().render(report);

        assertThat(html).contains("&ge; 95%");
        assertThat(html).contains("&ge; 90%");
        assertThat(html).contains("&le; 1000 ms");
        assertThat(html).contains("&le; 2000 ms");
    }

    @Test
    void shouldShowFractionalThresholdBandsExactly() {
        var thresholds = new VerdictThresholds(94.5, 1000.4, 90, 2000);
        PerformanceReport report = report(thresholds, 1000, 947, 300.0, 0, 10.0);
        assertThat(report.verdict()).isEqualTo(Verdict.PASS);

        String html = new HtmlReportRenderer().render(report);
        assertThat(html).contains("&ge; 94.5%");
        assertThat(html).contains("&le; 1000.4 ms");
        assertThat(html).doesNotContain("&ge; 95%");

        String text = new TextReportRenderer().render(report);
        assertThat(text).contains("Success rate:       94.70% [PASS] (pass >= 94.5%, unstable >= 90%)");
        assertThat(text).contains("(pass <= 1000.4 ms, unstable <= 2000 ms)");
    }

    @Test
    void shouldFormatLargeCounts() {
        String html = new HtmlReportRenderer().render(report(1_500_000, 1_500_000, 120.0, 0, 600.0));

        assertThat(html).contains("1.5M");
    }

    // --- Text ---

    @Test
    void shouldRenderTextSummary() {
        String text = new TextReportRenderer().render(passingReport());

        assertThat(text).contains("Verdict:            PASS");
        assertThat(text).contains("Total requests:     100");
        assertThat(text).contains("Errors:             4");
        assertThat(text).contains("Success rate:       96.00% [PASS]");
        assertThat(text).contains("Avg response:       300.0 ms [PASS]");
        assertThat(text).doesNotContain("WARNING");
        assertThat(text).doesNotContain("\r");
        assertThat(text.split("\n")).hasSize(13);
    }

    @Test
    void shouldWarnInTextReport() {
        String text = new TextReportRenderer().render(report(100, 70, 300.0, 3, 0.0));

        assertThat(text).contains("Verdict:            FAIL");
        assertThat(text).contains("Success rate:       70.00% [FAIL]");
        assertThat(text).contains("Malformed rows:     3");
        assertThat(text).contains("WARNING: 3 malformed sample rows were skipped");
        assertThat(text).contains("WARNING: samples span no positive time interval");
    }

    // --- JSON ---

    @Test
    void shouldRenderJsonWithAllFields() throws IOException {
        String json = new JsonReportRenderer().render(report(100, 91, 1500.0, 2, 10.0));

        JsonNode node = new ObjectMapper().readTree(json);
        assertThat(node.get("totalCount").asLong()).isEqualTo(100);
        assertThat(node.get("successCount").asLong()).isEqualTo(91);
        assertThat(node.get("errorCount").asLong()).isEqualTo(9);
        assertThat(node.get("malformedCount").asLong()).isEqualTo(2);
        assertThat(node.get("successRatePct").asDouble()).isEqualTo(91.0);
        assertThat(node.get("avgResponseMs").asDouble()).isEqualTo(1500.0);
        assertThat(node.get("throughputRps").asDouble()).isEqualTo(10.0);
        assertThat(node.get("verdict").asText()).isEqualTo("UNSTABLE");
        assertThat(node.get("thresholds").get("passMinSuccessRatePct").asDouble()).isEqualTo(95.0);
    }

    // --- Files ---

    @Test
    void shouldWriteReportsCreatingParentDirectories() throws IOException {
        PerformanceReport report = passingReport();
        Path nested = tempDir.resolve("target/reports/perf");

        Path html = new HtmlReportRenderer().generate(report, nested.resolve("report.html"));
        Path json = new JsonReportRenderer().generate(report, nested.resolve("report.json"));
        Path text = new TextReportRenderer().generate(report, nested.resolve("report.txt"));

        assertThat(html).exists();
        assertThat(Files.readString(html)).contains("badge-pass");
        assertThat(Files.readString(json)).contains("\"verdict\" : \"PASS\"");
        assertThat(Files.readString(text)).contains("Verdict:            PASS");
    }

    @Test
    void shouldReportFormatNames() {
        ReportRenderer html = new HtmlReportRenderer();
        ReportRenderer text = new TextReportRenderer();
        ReportRenderer json = new JsonReportRenderer();

        assertThat(html.format()).isEqualTo("HTML");
        assertThat(text.format()).isEqualTo("TEXT");
        assertThat(json.format()).isEqualTo("JSON");
    }

    // --- Helpers ---

    private static PerformanceReport passingReport() {
        return report(100, 96, 300.0, 0, 10.0);
    }

    private static PerformanceReport report(long total, long success, double avg, long malformed, double durationSec) {
        return report(VerdictThresholds.defaults(), total, success, avg, malformed, durationSec);
    }

    private static PerformanceReport report(VerdictThresholds thresholds, long total, long success, double avg,
                                            long malformed, double durationSec) {
        double successRate = success * 100.0 / total;
        Verdict verdict = thresholds.classify(successRate, avg);
        return new PerformanceReport(total, success, total - success, malformed,
                successRate, 100.0 - successRate, avg, 10, 5000,
                durationSec, durationSec > 0 ? total / durationSec : 0.0,
                verdict, thresholds);
    }
}
