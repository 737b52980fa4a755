package io.perfwatch.core.report;

import io.perfwatch.api.analysis.PerformanceReport;
import io.perfwatch.api.analysis.Rating;
import io.perfwatch.api.report.ReportRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * File handling and number formatting shared by the renderers.
 */
public abstract class AbstractReportRenderer implements ReportRenderer {

    private static final Logger log = LoggerFactory.getLogger(AbstractReportRenderer.class);

    @Override
    public Path generate(PerformanceReport report, Path outputPath) {
        String content = render(report);
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputPath, content, StandardCharsets.UTF_8);
            log.info("{} report generated: {}", format(), outputPath.toAbsolutePath());
            return outputPath;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + format() + " report to " + outputPath, e);
        }
    }

    static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }

    /**
     * Threshold value exactly as configured: {@code 95}, {@code 94.5}, {@code 1000.4}.
     */
    static String band(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    static String formatNumber(long n) {
        if (n >= 1_000_000) return fmt("%.1fM", n / 1_000_000.0);
        if (n >= 1_000) return fmt("%.1fK", n / 1_000.0);
        return String.valueOf(n);
    }

    static String label(Rating rating) {
        return switch (rating) {
            case GOOD -> "pass";
            case WARN -> "warn";
            case BAD -> "fail";
        };
    }
}
