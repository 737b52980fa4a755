package io.perfwatch.web.server;

import java.util.Map;

/**
 * Configuration for the embedded metrics server.
 */
public final class ServerConfig {

    public static final int DEFAULT_PORT = 3000;

    private int port = DEFAULT_PORT;
    private String metricsPath = "/metrics";
    private String healthPath = "/health";
    private String baseDir = null; // null = temporary directory

    private ServerConfig() {}

    public static ServerConfig create() {
        return new ServerConfig();
    }

    /**
     * Defaults, with the port taken from the {@code PORT} environment variable when set.
     */
    public static ServerConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static ServerConfig fromEnvironment(Map<String, String> env) {
        ServerConfig config = create();
        String port = env.get("PORT");
        if (port != null && !port.isBlank()) {
            try {
                config.port(Integer.parseInt(port.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("PORT must be a number: " + port, e);
            }
        }
        return config;
    }

    /**
     * Port to listen on; 0 picks a free port.
     */
    public ServerConfig port(int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port must be between 0 and 65535");
        }
        this.port = port;
        return this;
    }

    public ServerConfig metricsPath(String metricsPath) {
        this.metricsPath = requirePath(metricsPath);
        return this;
    }

    public ServerConfig healthPath(String healthPath) {
        this.healthPath = requirePath(healthPath);
        return this;
    }

    /**
     * Tomcat working directory.
     */
    public ServerConfig baseDir(String baseDir) {
        this.baseDir = baseDir;
        return this;
    }

    public int port() { return port; }
    public String metricsPath() { return metricsPath; }
    public String healthPath() { return healthPath; }
    public String baseDir() { return baseDir; }

    private static String requirePath(String path) {
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("Path must start with '/': " + path);
        }
        return path;
    }
}
