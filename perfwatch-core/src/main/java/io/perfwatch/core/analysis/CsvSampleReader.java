package io.perfwatch.core.analysis;

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
import java.util.Locale;

/**
 * Reads JMeter-style delimited results (JTL/CSV with a header row).
 * <p>
 * The {@code timeStamp}, {@code elapsed} and {@code success} columns are located by name, so
 * extra columns and any column order are accepted. Quoted fields may contain the delimiter,
 * escaped quotes and line breaks.
 */
public class CsvSampleReader implements SampleSource {

    private static final Logger log = LoggerFactory.getLogger(CsvSampleReader.class);

    static final String TIMESTAMP_COLUMN = "timestamp";
    static final String ELAPSED_COLUMN = "elapsed";
    static final String SUCCESS_COLUMN = "success";

    private final Path path;
    private final char delimiter;

    public CsvSampleReader(Path path) {
        this(path, ',');
    }

    public CsvSampleReader(Path path, char delimiter) {
        this.path = path;
        this.delimiter = delimiter;
    }

    @Override
    public SampleBatch read() throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<String> header = nextRow(reader);
            if (header == null) {
                log.warn("Sample file {} is empty", path);
                return new SampleBatch(List.of(), 0);
            }
            int tsIdx = columnIndex(header, TIMESTAMP_COLUMN);
            int elapsedIdx = columnIndex(header, ELAPSED_COLUMN);
            int successIdx = columnIndex(header, SUCCESS_COLUMN);

            List<SampleRecord> records = new ArrayList<>();
            int malformed = 0;
            List<String> row;
            while ((row = nextRow(reader)) != null) {
                if (row.size() == 1 && row.get(0).isBlank()) {
                    continue;
                }
                SampleRecord record = parse(row, tsIdx, elapsedIdx, successIdx);
                if (record != null) {
                    records.add(record);
                } else {
                    malformed++;
                }
            }
            log.info("Read {} samples from {} ({} malformed)", records.size(), path, malformed);
            return new SampleBatch(records, malformed);
        }
    }

    private SampleRecord parse(List<String> row, int tsIdx, int elapsedIdx, int successIdx) {
        if (row.size() <= Math.max(tsIdx, Math.max(elapsedIdx, successIdx))) {
            return null;
        }
        Long timestamp = SampleParsing.parseLong(row.get(tsIdx));
        Long elapsed = SampleParsing.parseLong(row.get(elapsedIdx));
        Boolean success = SampleParsing.parseBoolean(row.get(successIdx));
        if (timestamp == null || elapsed == null || elapsed < 0 || success == null) {
            return null;
        }
        return new SampleRecord(timestamp, elapsed, success);
    }

    private static int columnIndex(List<String> header, String name) {
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i).trim().toLowerCase(Locale.ROOT).equals(name)) {
                return i;
            }
        }
        throw new IllegalArgumentException("Missing required column '" + name + "' in header " + header);
    }

    /**
     * Split the next logical row. Returns {@code null} at end of input.
     */
    List<String> nextRow(BufferedReader reader) throws IOException {
        String line = reader.readLine();
        if (line == null) {
            return null;
        }
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        while (true) {
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                if (quoted) {
                    if (c == '"') {
                        if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                            field.append('"');
                            i++;
                        } else {
                            quoted = false;
                        }
                    } else {
                        field.append(c);
                    }
                } else if (c == '"') {
                    quoted = true;
                } else if (c == delimiter) {
                    fields.add(field.toString());
                    field.setLength(0);
                } else {
                    field.append(c);
                }
            }
            if (!quoted) {
                break;
            }
            // quoted field spans a line break
            line = reader.readLine();
            if (line == null) {
                break;
            }
            field.append('\n');
        }
        fields.add(field.toString());
        return fields;
    }
}
