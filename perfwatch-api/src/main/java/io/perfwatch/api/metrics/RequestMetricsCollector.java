package io.perfwatch.api.metrics;

/**
 * Live request instrumentation.
 * <p>
 * Implementations keep their state in an explicitly constructed registry so that every
 * server (and every test) owns an isolated set of meters. None of the methods may throw
 * into the request path: recording failures surface only as missing metrics.
 */
public interface RequestMetricsCollector extends AutoCloseable {

    /**
     * Called once per inbound request before dispatch. Increments the active connection gauge.
     *
     * @return the token that every terminal signal for this request must pass back
     */
    RequestToken onRequestStart();

    /**
     * Called from any terminal path of a request. The first call for a token decrements the
     * active connection gauge and records one duration observation; later calls are no-ops.
     *
     * @param token      token returned by {@link #onRequestStart()}
     * @param method     HTTP method
     * @param route      route template (or literal path as fallback)
     * @param statusCode response status
     * @param durationMs observed duration
     * @return {@code true} if this call performed the terminal bookkeeping
     */
    boolean onRequestTerminal(RequestToken token, String method, String route, int statusCode, long durationMs);

    /**
     * Same as {@link #onRequestTerminal(RequestToken, String, String, int, long)} with the
     * duration measured from the token's start.
     */
    default boolean onRequestTerminal(RequestToken token, String method, String route, int statusCode) {
        return token != null && onRequestTerminal(token, method, route, statusCode, token.elapsedMillis());
    }

    /**
     * Render every registered meter in the text exposition format.
     */
    String snapshot();

    /**
     * @return the content type matching {@link #snapshot()}
     */
    String contentType();

    long activeConnections();

    @Override
    void close();
}
