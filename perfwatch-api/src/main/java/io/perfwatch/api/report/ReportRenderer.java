package io.perfwatch.api.report;

import io.perfwatch.api.analysis.PerformanceReport;

import java.nio.file.Path;

/**
 * Renders a {@link PerformanceReport} for humans or tools.
 * Implementations can produce HTML, plain text, JSON, or any other format.
 */
public interface ReportRenderer {

    /**
     * Format the report. Pure: no computation beyond formatting.
     */
    String render(PerformanceReport report);

    /**
     * Render the report into a file, creating parent directories as needed.
     *
     * @param report     the report
     * @param outputPath path where the file should be written
     * @return the path to the generated file
     */
    Path generate(PerformanceReport report, Path outputPath);

    /**
     * @return the format name (e.g., "HTML", "TEXT", "JSON")
     */
    String format();
}
