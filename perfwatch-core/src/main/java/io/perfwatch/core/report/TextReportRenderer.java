package io.perfwatch.core.report;

import io.perfwatch.api.analysis.PerformanceReport;
import io.perfwatch.api.analysis.VerdictThresholds;

import java.util.Locale;

/**
 * Plain text summary for consoles and CI logs.
 */
public class TextReportRenderer extends AbstractReportRenderer {

    @Override
    public String render(PerformanceReport r) {
        VerdictThresholds t = r.thresholds();
        StringBuilder sb = new StringBuilder();
        sb.append("Performance report\n");
        sb.append("------------------\n");
        sb.append(fmt("Verdict:            %s\n", r.verdict()));
        sb.append(fmt("Total requests:     %d\n", r.totalCount()));
        sb.append(fmt("Successful:         %d\n", r.successCount()));
        sb.append(fmt("Errors:             %d\n", r.errorCount()));
        sb.append(fmt("Malformed rows:     %d\n", r.malformedCount()));
        sb.append(fmt("Success rate:       %.2f%% [%s] (pass >= %s%%, unstable >= %s%%)\n",
                r.successRatePct(), label(r.successRating()).toUpperCase(Locale.ROOT),
                band(t.passMinSuccessRatePct()), band(t.unstableMinSuccessRatePct())));
        sb.append(fmt("Error rate:         %.2f%%\n", r.errorRatePct()));
        sb.append(fmt("Avg response:       %.1f ms [%s] (pass <= %s ms, unstable <= %s ms)\n",
                r.avgResponseMs(), label(r.responseTimeRating()).toUpperCase(Locale.ROOT),
                band(t.passMaxAvgResponseMs()), band(t.unstableMaxAvgResponseMs())));
        sb.append(fmt("Min / max response: %d ms / %d ms\n", r.minResponseMs(), r.maxResponseMs()));
        sb.append(fmt("Duration:           %.1f s\n", r.durationSec()));
        sb.append(fmt("Throughput:         %.2f rps\n", r.throughputRps()));
        if (r.hasMalformedSamples()) {
            sb.append(fmt("WARNING: %d malformed sample rows were skipped\n", r.malformedCount()));
        }
        if (r.degenerateDuration()) {
            sb.append("WARNING: samples span no positive time interval, throughput reported as 0\n");
        }
        return sb.toString();
    }

    @Override
    public String format() {
        return "TEXT";
    }
}
