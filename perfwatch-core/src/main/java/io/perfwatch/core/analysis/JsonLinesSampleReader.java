package io.perfwatch.core.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.perfwatch.api.analysis.SampleBatch;
import io.perfwatch.api.analysis.SampleRecord;
import io.perfwatch.api.analysis.SampleSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads one JSON object per line.
 * <p>
 * Accepted field names: {@code timestampMs}, {@code timeStamp} or {@code timestamp} (epoch millis);
 * {@code elapsedMs} or {@code elapsed}; {@code success}. Blank lines are skipped.
 */
public class JsonLinesSampleReader implements SampleSource {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesSampleReader.class);

    private static final String[] TIMESTAMP_FIELDS = {"timestampMs", "timeStamp", "timestamp"};
    private static final String[] ELAPSED_FIELDS = {"elapsedMs", "elapsed"};

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonLinesSampleReader(Path path) {
        this(path, new ObjectMapper());
    }

    public JsonLinesSampleReader(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public SampleBatch read() throws IOException {
        List<SampleRecord> records = new ArrayList<>();
        int malformed = 0;
        int lineNumber = 0;

        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                SampleRecord record = parse(line, lineNumber);
                if (record != null) {
                    records.add(record);
                } else {
                    malformed++;
                }
            }
        }

        log.info("Read {} samples from {} ({} malformed)", records.size(), path, malformed);
        return new SampleBatch(records, malformed);
    }

    private SampleRecord parse(String line, int lineNumber) {
        JsonNode node;
        try {
            node = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.debug("Line {} of {} is not valid JSON: {}", lineNumber, path, e.getOriginalMessage());
            return null;
        }
        if (node == null || !node.isObject()) {
            return null;
        }
        Long timestamp = longField(node, TIMESTAMP_FIELDS);
        Long elapsed = longField(node, ELAPSED_FIELDS);
        Boolean success = booleanField(node.get("success"));
        if (timestamp == null || elapsed == null || elapsed < 0 || success == null) {
            return null;
        }
        return new SampleRecord(timestamp, elapsed, success);
    }

    private static Long longField(JsonNode node, String[] names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isIntegralNumber()) {
                return value.asLong();
            }
            return value.isTextual() ? SampleParsing.parseLong(value.asText()) : null;
        }
        return null;
    }

    private static Boolean booleanField(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        return value.isTextual() ? SampleParsing.parseBoolean(value.asText()) : null;
    }
}
