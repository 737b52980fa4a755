package io.perfwatch.web.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.perfwatch.api.metrics.RequestMetricsCollector;
import io.perfwatch.web.filter.RequestMetricsFilter;
import io.perfwatch.web.route.RouteResolver;
import io.perfwatch.web.route.ServletMappingRouteResolver;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.catalina.Context;
import org.apache.catalina.Wrapper;
import org.apache.catalina.startup.Tomcat;
import org.apache.tomcat.util.descriptor.web.FilterDef;
import org.apache.tomcat.util.descriptor.web.FilterMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Embedded Tomcat server that provides:
 * - request instrumentation for every request via {@link RequestMetricsFilter}
 * - a text exposition endpoint for scrapers (default {@code /metrics})
 * - a health endpoint (default {@code /health})
 * - a JSON 404 for unmatched paths, so they are instrumented too
 * <p>
 * Application servlets are added with {@link #addServlet} before {@link #start()}.
 */
public class MetricsServer {

    private static final Logger log = LoggerFactory.getLogger(MetricsServer.class);

    private final ServerConfig config;
    private final RequestMetricsCollector collector;
    private final RouteResolver routeResolver;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, ServletRegistration> servlets = new LinkedHashMap<>();
    private Tomcat tomcat;

    public MetricsServer(ServerConfig config, RequestMetricsCollector collector) {
        this(config, collector, new ServletMappingRouteResolver());
    }

    public MetricsServer(ServerConfig config, RequestMetricsCollector collector, RouteResolver routeResolver) {
        this.config = config;
        this.collector = collector;
        this.routeResolver = routeResolver;
    }

    /**
     * Register an application servlet under a URL pattern.
     */
    public MetricsServer addServlet(String name, String pattern, HttpServlet servlet) {
        if (tomcat != null) {
            throw new IllegalStateException("Servlets must be added before the server starts");
        }
        servlets.put(name, new ServletRegistration(pattern, servlet));
        return this;
    }

    public void start() {
        try {
            tomcat = new Tomcat();
            tomcat.setBaseDir(config.baseDir() != null
                    ? config.baseDir()
                    : Files.createTempDirectory("perfwatch-tomcat").toString());
            tomcat.setPort(config.port());
            tomcat.getConnector(); // trigger connector creation

            Context ctx = tomcat.addContext("", null);

            // Instrument every request
            FilterDef filterDef = new FilterDef();
            filterDef.setFilterName("requestMetrics");
            filterDef.setFilter(new RequestMetricsFilter(collector, routeResolver));
            filterDef.setAsyncSupported("true");
            ctx.addFilterDef(filterDef);
            FilterMap filterMap = new FilterMap();
            filterMap.setFilterName("requestMetrics");
            filterMap.addURLPattern("/*");
            ctx.addFilterMap(filterMap);

            // Exposition for scrapers
            Tomcat.addServlet(ctx, "metrics", new MetricsServlet());
            ctx.addServletMappingDecoded(config.metricsPath(), "metrics");

            // Liveness
            Tomcat.addServlet(ctx, "health", new HealthServlet());
            ctx.addServletMappingDecoded(config.healthPath(), "health");

            servlets.forEach((name, registration) -> {
                Wrapper wrapper = Tomcat.addServlet(ctx, name, registration.servlet());
                wrapper.setAsyncSupported(true);
                ctx.addServletMappingDecoded(registration.pattern(), name);
            });

            // Unmatched paths still pass through the filter
            if (servlets.values().stream().noneMatch(r -> r.pattern().equals("/"))) {
                Tomcat.addServlet(ctx, "notFound", new NotFoundServlet());
                ctx.addServletMappingDecoded("/", "notFound");
            }

            tomcat.start();
            log.info("Perfwatch server started on port {}", port());

        } catch (Exception e) {
            throw new RuntimeException("Failed to start metrics server", e);
        }
    }

    public void stop() {
        try {
            if (tomcat != null) {
                tomcat.stop();
                tomcat.destroy();
            }
            log.info("Perfwatch server stopped");
        } catch (Exception e) {
            log.error("Error stopping metrics server", e);
        }
    }

    /**
     * @return the bound port, which differs from the configured one when that was 0
     */
    public int port() {
        return tomcat != null ? tomcat.getConnector().getLocalPort() : config.port();
    }

    public RequestMetricsCollector collector() {
        return collector;
    }

    // --- Servlets ---

    private class MetricsServlet extends HttpServlet {
        @Override
        protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            resp.setContentType(collector.contentType());
            resp.getWriter().write(collector.snapshot());
        }
    }

    private class HealthServlet extends HttpServlet {
        @Override
        protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            resp.setContentType("application/json");
            resp.setCharacterEncoding("UTF-8");
            resp.getWriter().write(objectMapper.writeValueAsString(new HealthResponse(true)));
        }
    }

    private class NotFoundServlet extends HttpServlet {
        @Override
        protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            resp.setStatus(HttpServletResponse.SC_NOT_FOUND);
            resp.setContentType("application/json");
            resp.setCharacterEncoding("UTF-8");
            resp.getWriter().write(objectMapper.writeValueAsString(new ErrorResponse("not found")));
        }
    }

    record HealthResponse(boolean ok) {}

    record ErrorResponse(String error) {}

    private record ServletRegistration(String pattern, HttpServlet servlet) {}
}
