package io.perfwatch.web.route;

import jakarta.servlet.http.HttpServletMapping;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.MappingMatch;

/**
 * Uses the servlet mapping pattern that matched the request ({@code /cart}, {@code /products/*}).
 * Requests served by the default servlet matched no route and are labelled with their
 * literal path.
 */
public class ServletMappingRouteResolver implements RouteResolver {

    @Override
    public String resolve(HttpServletRequest request) {
        HttpServletMapping mapping = request.getHttpServletMapping();
        if (mapping == null || mapping.getMappingMatch() == null
                || mapping.getMappingMatch() == MappingMatch.DEFAULT) {
            return RouteResolver.literalPath(request);
        }
        if (mapping.getMappingMatch() == MappingMatch.CONTEXT_ROOT) {
            return "/";
        }
        String pattern = mapping.getPattern();
        return pattern == null || pattern.isEmpty() ? RouteResolver.literalPath(request) : pattern;
    }
}
