package io.perfwatch.core.analysis;

import io.perfwatch.api.analysis.SampleSource;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Picks a {@link SampleSource} implementation from a file's extension.
 */
public final class SampleSources {

    private SampleSources() {}

    public static SampleSource forPath(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".csv") || name.endsWith(".jtl")) {
            return new CsvSampleReader(path);
        }
        if (name.endsWith(".jsonl") || name.endsWith(".ndjson") || name.endsWith(".json")) {
            return new JsonLinesSampleReader(path);
        }
        throw new IllegalArgumentException("Unsupported sample file type: " + path.getFileName()
                + " (expected .csv, .jtl, .jsonl, .ndjson or .json)");
    }
}
