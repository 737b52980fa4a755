package io.perfwatch.api.metrics;

/**
 * A finished request, as observed by the collector.
 *
 * @param method     HTTP method
 * @param route      matched route template, or the literal path when nothing matched
 * @param statusCode response status
 * @param durationMs time from request start to its terminal signal
 */
public record RequestEvent(
        String method,
        String route,
        int statusCode,
        long durationMs
) {}
