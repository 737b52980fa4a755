package io.perfwatch.web.route;

import jakarta.servlet.http.HttpServletRequest;

import java.util.ArrayList;
import java.util.List;

/**
 * Matches the literal path against a finite table of templates such as {@code /orders/{id}}.
 * A segment in braces matches any single non-empty path segment. Templates are tried in
 * registration order; the first match wins. Unmatched requests go to the fallback resolver.
 */
public class TemplateRouteResolver implements RouteResolver {

    private final List<Template> templates = new ArrayList<>();
    private final RouteResolver fallback;

    public TemplateRouteResolver() {
        this(new ServletMappingRouteResolver());
    }

    public TemplateRouteResolver(RouteResolver fallback) {
        this.fallback = fallback;
    }

    public TemplateRouteResolver template(String template) {
        if (template == null || !template.startsWith("/")) {
            throw new IllegalArgumentException("Route template must start with '/': " + template);
        }
        templates.add(new Template(template, segments(template)));
        return this;
    }

    @Override
    public String resolve(HttpServletRequest request) {
        String match = match(RouteResolver.literalPath(request));
        return match != null ? match : fallback.resolve(request);
    }

    /**
     * @return the first template matching {@code path}, or {@code null}
     */
    public String match(String path) {
        String[] actual = segments(path);
        for (Template template : templates) {
            if (template.matches(actual)) {
                return template.text();
            }
        }
        return null;
    }

    private static String[] segments(String path) {
        String trimmed = path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        return trimmed.equals("/") ? new String[0] : trimmed.substring(1).split("/", -1);
    }

    private record Template(String text, String[] segments) {

        boolean matches(String[] actual) {
            if (actual.length != segments.length) {
                return false;
            }
            for (int i = 0; i < segments.length; i++) {
                String expected = segments[i];
                boolean variable = expected.startsWith("{") && expected.endsWith("}");
                if (variable ? actual[i].isEmpty() : !expected.equals(actual[i])) {
                    return false;
                }
            }
            return true;
        }
    }
}
