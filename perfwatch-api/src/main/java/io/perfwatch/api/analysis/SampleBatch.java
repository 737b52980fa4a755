package io.perfwatch.api.analysis;

import java.util.List;

/**
 * The parseable samples of one source, in original order, plus the number of rows that
 * could not be parsed.
 */
public record SampleBatch(
        List<SampleRecord> records,
        int malformedCount
) {

    public SampleBatch {
        records = List.copyOf(records);
        if (malformedCount < 0) {
            throw new IllegalArgumentException("Malformed count must not be negative");
        }
    }

    public static SampleBatch of(List<SampleRecord> records) {
        return new SampleBatch(records, 0);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
