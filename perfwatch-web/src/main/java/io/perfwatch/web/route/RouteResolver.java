package io.perfwatch.web.route;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Maps a request to the route label used on the duration histogram.
 * <p>
 * Implementations should return a route template so that the label set stays bounded.
 * When no template applies they fall back to the literal request path; with unbounded
 * client-chosen paths that fallback is a cardinality risk.
 */
@FunctionalInterface
public interface RouteResolver {

    String resolve(HttpServletRequest request);

    /**
     * Path of the request inside the web application, without query string.
     */
    static String literalPath(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (uri == null || uri.isEmpty()) {
            return "/";
        }
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            uri = uri.substring(contextPath.length());
        }
        return uri.isEmpty() ? "/" : uri;
    }
}
