package io.perfwatch.api.analysis;

import java.io.IOException;

/**
 * Reads sample rows in their original order. The physical encoding (delimited text,
 * JSON lines) is up to the implementation.
 */
public interface SampleSource {

    /**
     * Read every row. Rows that cannot be parsed are counted, not returned.
     *
     * @throws IOException if the underlying source cannot be read
     */
    SampleBatch read() throws IOException;
}
