package io.perfwatch.web.server;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServerConfigTest {

    @Test
    void shouldUseDefaults() {
        ServerConfig config = ServerConfig.create();

        assertThat(config.port()).isEqualTo(3000);
        assertThat(config.metricsPath()).isEqualTo("/metrics");
        assertThat(config.healthPath()).isEqualTo("/health");
        assertThat(config.baseDir()).isNull();
    }

    @Test
    void shouldReadPortFromEnvironment() {
        assertThat(ServerConfig.fromEnvironment(Map.of("PORT", "8081")).port()).isEqualTo(8081);
        assertThat(ServerConfig.fromEnvironment(Map.of("PORT", " 9090 ")).port()).isEqualTo(9090);
        assertThat(ServerConfig.fromEnvironment(Map.of()).port()).isEqualTo(ServerConfig.DEFAULT_PORT);
        assertThat(ServerConfig.fromEnvironment(Map.of("PORT", "")).port()).isEqualTo(ServerConfig.DEFAULT_PORT);
    }

    @Test
    void shouldRejectInvalidPort() {
        assertThatThrownBy(() -> ServerConfig.fromEnvironment(Map.of("PORT", "http")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("PORT");
        assertThatThrownBy(() -> ServerConfig.fromEnvironment(Map.of("PORT", "70000")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ServerConfig.create().port(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRequireAbsoluteEndpointPaths() {
        ServerConfig config = ServerConfig.create().metricsPath("/prometheus").healthPath("/live");

        assertThat(config.metricsPath()).isEqualTo("/prometheus");
        assertThat(config.healthPath()).isEqualTo("/live");
        assertThatThrownBy(() -> ServerConfig.create().metricsPath("metrics"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
