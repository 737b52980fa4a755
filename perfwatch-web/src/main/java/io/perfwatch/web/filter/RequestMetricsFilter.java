package io.perfwatch.web.filter;

import io.perfwatch.api.metrics.RequestMetricsCollector;
import io.perfwatch.api.metrics.RequestToken;
import io.perfwatch.web.route.RouteResolver;
import io.perfwatch.web.route.ServletMappingRouteResolver;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Brackets every request with {@link RequestMetricsCollector#onRequestStart()} and
 * {@link RequestMetricsCollector#onRequestTerminal}.
 * <p>
 * Synchronous requests end in this filter. Asynchronous requests end from an
 * {@link AsyncListener}; the container may deliver both an error (or timeout) and a completion
 * for the same request, and the request token makes sure only the first one counts.
 * Metrics failures are logged and never change the response.
 */
public class RequestMetricsFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(RequestMetricsFilter.class);

    private final RequestMetricsCollector collector;
    private final RouteResolver routeResolver;

    public RequestMetricsFilter(RequestMetricsCollector collector) {
        this(collector, new ServletMappingRouteResolver());
    }

    public RequestMetricsFilter(RequestMetricsCollector collector, RouteResolver routeResolver) {
        this.collector = collector;
        this.routeResolver = routeResolver;
    }

    @Override
    public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain)
            throws IOException, ServletException {
        if (!(req instanceof HttpServletRequest request) || !(res instanceof HttpServletResponse response)) {
            chain.doFilter(req, res);
            return;
        }

        RequestToken token = start();
        boolean failed = true;
        try {
            chain.doFilter(request, response);
            failed = false;
        } finally {
            if (token != null) {
                if (!failed && request.isAsyncStarted()) {
                    listen(token, request, response);
                } else {
                    finish(token, request, response, failed);
                }
            }
        }
    }

    private void listen(RequestToken token, HttpServletRequest request, HttpServletResponse response) {
        try {
            request.getAsyncContext().addListener(new TerminalListener(token, request, response));
        } catch (RuntimeException e) {
            // no async signal will reach the token, end it now
            log.warn("Failed to register async listener for {}", request.getRequestURI(), e);
            finish(token, request, response, false);
        }
    }

    private RequestToken start() {
        try {
            return collector.onRequestStart();
        } catch (RuntimeException e) {
            log.warn("Failed to start request metrics", e);
            return null;
        }
    }

    void finish(RequestToken token, HttpServletRequest request, HttpServletResponse response, boolean failed) {
        try {
            int status = failed && !response.isCommitted()
                    ? HttpServletResponse.SC_INTERNAL_SERVER_ERROR
                    : response.getStatus();
            collector.onRequestTerminal(token, request.getMethod(), route(request), status);
        } catch (RuntimeException e) {
            log.warn("Failed to finish request metrics for {}", request.getRequestURI(), e);
        }
    }

    private String route(HttpServletRequest request) {
        try {
            return routeResolver.resolve(request);
        } catch (RuntimeException e) {
            log.debug("Route resolution failed, using literal path", e);
            return RouteResolver.literalPath(request);
        }
    }

    /**
     * Routes every async terminal signal to the same token.
     */
    private class TerminalListener implements AsyncListener {

        private final RequestToken token;
        private final HttpServletRequest request;
        private final HttpServletResponse response;

        TerminalListener(RequestToken token, HttpServletRequest request, HttpServletResponse response) {
            this.token = token;
            this.request = request;
            this.response = response;
        }

        @Override
        public void onComplete(AsyncEvent event) {
            finish(token, request, response, false);
        }

        @Override
        public void onTimeout(AsyncEvent event) {
            finish(token, request, response, true);
        }

        @Override
        public void onError(AsyncEvent event) {
            finish(token, request, response, true);
        }

        @Override
        public void onStartAsync(AsyncEvent event) {
            // re-dispatch started a new async cycle; keep listening on it
            event.getAsyncContext().addListener(this);
        }
    }
}
