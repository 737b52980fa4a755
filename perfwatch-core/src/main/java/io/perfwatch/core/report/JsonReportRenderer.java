package io.perfwatch.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.perfwatch.api.analysis.PerformanceReport;

import java.io.UncheckedIOException;

/**
 * Serializes the report as indented JSON for downstream tools.
 */
public class JsonReportRenderer extends AbstractReportRenderer {

    private final ObjectMapper objectMapper;

    public JsonReportRenderer() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String render(PerformanceReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize report", e);
        }
    }

    @Override
    public String format() {
        return "JSON";
    }
}
