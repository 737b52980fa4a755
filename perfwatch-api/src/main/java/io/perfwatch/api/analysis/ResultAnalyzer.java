package io.perfwatch.api.analysis;

import java.util.List;

/**
 * Turns a finished run's samples into a {@link PerformanceReport}.
 * Implementations are pure: the same input always yields an equal report.
 */
public interface ResultAnalyzer {

    /**
     * @param records samples ordered by timestamp
     * @throws EmptyInputException if {@code records} is empty
     */
    PerformanceReport analyze(List<SampleRecord> records);

    /**
     * Analyze the valid samples of a batch, carrying its malformed row count into the report.
     *
     * @throws EmptyInputException if the batch holds no valid samples
     */
    PerformanceReport analyze(SampleBatch batch);
}
