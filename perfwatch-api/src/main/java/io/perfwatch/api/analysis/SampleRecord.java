package io.perfwatch.api.analysis;

/**
 * One completed request as recorded by the load test harness.
 *
 * @param timestampMs epoch millis at which the sample started
 * @param elapsedMs   response time in milliseconds
 * @param success     whether the harness considered the request successful
 */
public record SampleRecord(
        long timestampMs,
        long elapsedMs,
        boolean success
) {}
