package io.perfwatch.core.report;

import io.perfwatch.api.analysis.PerformanceReport;
import io.perfwatch.api.analysis.Rating;
import io.perfwatch.api.analysis.Verdict;
import io.perfwatch.api.analysis.VerdictThresholds;

import java.util.Locale;

/**
 * Renders a standalone HTML page for a load test run.
 * <p>
 * The page includes:
 * <ul>
 *   <li>Verdict badge</li>
 *   <li>Summary cards (requests, success/error counts and rates, response times, throughput)</li>
 *   <li>Threshold bands table with the rating of each metric</li>
 *   <li>Notices for malformed samples and a degenerate run duration</li>
 * </ul>
 * Success rate and average response time are coloured from the same thresholds that decide
 * the verdict. No external resources are referenced.
 */
public class HtmlReportRenderer extends AbstractReportRenderer {

    @Override
    public String render(PerformanceReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(htmlHead());
        sb.append("<body><div class=\"wrap\">\n");
        sb.append(header(report.verdict()));
        sb.append(notices(report));
        sb.append(summaryCards(report));
        sb.append(thresholdTable(report));
        sb.append(footer());
        sb.append("</div></body>\n");
        sb.append("</html>\n");
        return sb.toString();
    }

    @Override
    public String format() {
        return "HTML";
    }

    // ─── HTML sections ───

    private String htmlHead() {
        return """
                <!DOCTYPE html>
                <html lang="en">
                <head>
                <meta charset="UTF-8">
                <meta name="viewport" content="width=device-width, initial-scale=1.0">
                <title>Perfwatch Performance Report</title>
                <style>
                :root {
                    --bg: #0f1117; --surface: #161b22; --border: #2a3343;
                    --text: #e1e4e8; --muted: #7a8ba5; --dim: #4a5b73;
                    --blue: #3b8bff; --cyan: #22d3ee; --green: #34d399;
                    --red: #ef4444; --amber: #f59e0b; --purple: #a78bfa;
                }
                * { margin: 0; padding: 0; box-sizing: border-box; }
                body { font-family: -apple-system, BlinkMacSystemFont, 'Segoe UI', Roboto, sans-serif; background: var(--bg); color: var(--text); }
                .wrap { max-width: 1100px; margin: 0 auto; padding: 40px 24px; }
                .header { margin-bottom: 32px; display: flex; align-items: center; gap: 16px; }
                .header h1 { font-size: 28px; font-weight: 800; }
                .header h1 span { color: var(--blue); }
                .cards { display: grid; grid-template-columns: repeat(auto-fit, minmax(160px, 1fr)); gap: 12px; margin-bottom: 40px; }
                .card { background: var(--surface); border: 1px solid var(--border); border-radius: 10px; padding: 20px; }
                .card-label { font-size: 11px; color: var(--dim); text-transform: uppercase; letter-spacing: 1px; margin-bottom: 6px; }
                .card-val { font-size: 26px; font-weight: 800; font-variant-numeric: tabular-nums; }
                .card-val.blue { color: var(--blue); } .card-val.cyan { color: var(--cyan); }
                .card-val.purple { color: var(--purple); }
                .card-sub { font-size: 12px; color: var(--muted); margin-top: 4px; }
                .pass { color: var(--green); } .warn { color: var(--amber); } .fail { color: var(--red); }
                .section { margin-bottom: 40px; }
                .section h2 { font-size: 18px; font-weight: 700; margin-bottom: 16px; color: var(--muted); }
                table { width: 100%; border-collapse: collapse; background: var(--surface); border: 1px solid var(--border); border-radius: 10px; overflow: hidden; }
                th { text-align: left; padding: 12px 16px; font-size: 11px; font-weight: 700; text-transform: uppercase; letter-spacing: 0.8px; color: var(--dim); background: rgba(0,0,0,0.3); border-bottom: 1px solid var(--border); }
                td { padding: 12px 16px; font-size: 14px; border-bottom: 1px solid rgba(42,51,67,0.5); font-variant-numeric: tabular-nums; }
                tr:last-child td { border-bottom: none; }
                .notice { background: rgba(245,158,11,0.12); border: 1px solid var(--amber); color: var(--amber); border-radius: 10px; padding: 14px 18px; margin-bottom: 16px; font-size: 14px; }
                .badge { display: inline-block; padding: 4px 12px; border-radius: 6px; font-size: 14px; font-weight: 800; }
                .badge-pass { background: rgba(52,211,153,0.15); color: var(--green); }
                .badge-unstable { background: rgba(245,158,11,0.15); color: var(--amber); }
                .badge-fail { background: rgba(239,68,68,0.15); color: var(--red); }
                footer { text-align: center; padding: 40px 0 20px; color: var(--dim); font-size: 13px; }
                @media print { body { background: #fff; color: #111; } .card, table { border-color: #ddd; } }
                </style>
                </head>
                """;
    }

    private String header(Verdict verdict) {
        return """
                <div class="header">
                    <h1><span>Perfwatch</span> Performance Report</h1>
                    <span id="verdict" class="badge badge-%s">%s</span>
                </div>
                """.formatted(verdict.name().toLowerCase(Locale.ROOT), verdict.name());
    }

    private String notices(PerformanceReport report) {
        StringBuilder sb = new StringBuilder();
        if (report.hasMalformedSamples()) {
            sb.append("""
                    <div class="notice" id="malformed-notice">%s malformed sample rows were skipped. \
                    They are not counted as successes or errors; check the load test output.</div>
                    """.formatted(formatNumber(report.malformedCount())));
        }
        if (report.degenerateDuration()) {
            sb.append("""
                    <div class="notice" id="duration-notice">The samples span no positive time interval \
                    (single timestamp or out-of-order samples). Throughput is reported as 0.</div>
                    """);
        }
        return sb.toString();
    }

    private String summaryCards(PerformanceReport r) {
        String successClass = label(r.successRating());
        String latencyClass = label(r.responseTimeRating());
        return """
                <div class="cards">
                    <div class="card"><div class="card-label">Total Requests</div><div class="card-val cyan">%s</div></div>
                    <div class="card"><div class="card-label">Successful</div><div class="card-val pass">%s</div></div>
                    <div class="card"><div class="card-label">Errors</div><div class="card-val fail">%s</div></div>
                    <div class="card"><div class="card-label">Malformed</div><div class="card-val %s">%s</div></div>
                    <div class="card"><div class="card-label">Success Rate</div><div id="success-rate" class="card-val %s">%s</div><div class="card-sub">error rate %s</div></div>
                    <div class="card"><div class="card-label">Avg Response</div><div id="avg-response" class="card-val %s">%s ms</div><div class="card-sub">min %d ms / max %d ms</div></div>
                    <div class="card"><div class="card-label">Throughput</div><div class="card-val blue">%s rps</div><div class="card-sub">over %s s</div></div>
                </div>
                """.formatted(
                formatNumber(r.totalCount()),
                formatNumber(r.successCount()),
                formatNumber(r.errorCount()),
                r.hasMalformedSamples() ? "warn" : "purple", formatNumber(r.malformedCount()),
                successClass, fmt("%.2f%%", r.successRatePct()), fmt("%.2f%%", r.errorRatePct()),
                latencyClass, fmt("%.1f", r.avgResponseMs()), r.minResponseMs(), r.maxResponseMs(),
                fmt("%.2f", r.throughputRps()), fmt("%.1f", r.durationSec()));
    }

    private String thresholdTable(PerformanceReport r) {
        VerdictThresholds t = r.thresholds();
        Rating success = r.successRating();
        Rating latency = r.responseTimeRating();
        return """
                <div class="section">
                <h2>Thresholds</h2>
                <table>
                <thead><tr><th>Metric</th><th>Actual</th><th>Pass</th><th>Unstable</th><th>Rating</th></tr></thead>
                <tbody>
                <tr><td>Success rate</td><td class="%s">%s</td><td>&ge; %s</td><td>&ge; %s</td><td class="%s">%s</td></tr>
                <tr><td>Avg response time</td><td class="%s">%s ms</td><td>&le; %s ms</td><td>&le; %s ms</td><td class="%s">%s</td></tr>
                </tbody></table>
                <p class="card-sub">PASS needs both metrics in the pass band; UNSTABLE needs both at least in the unstable band.</p>
                </div>
                """.formatted(
                label(success), fmt("%.2f%%", r.successRatePct()),
                band(t.passMinSuccessRatePct()) + "%", band(t.unstableMinSuccessRatePct()) + "%",
                label(success), success.name(),
                label(latency), fmt("%.1f", r.avgResponseMs()),
                band(t.passMaxAvgResponseMs()), band(t.unstableMaxAvgResponseMs()),
                label(latency), latency.name());
    }

    private String footer() {
        return """
                <footer>Generated by Perfwatch</footer>
                """;
    }
}
