package io.perfwatch.web.server;

import io.perfwatch.api.metrics.CollectorConfig;
import io.perfwatch.core.metrics.MicrometerRequestCollector;

import java.util.concurrent.CountDownLatch;

/**
 * Starts an instrumented server with the health and metrics endpoints.
 * <p>
 * Run with:
 * <pre>{@code
 * PORT=3000 mvn compile exec:java -pl perfwatch-web \
 *   -Dexec.mainClass="io.perfwatch.web.server.PerfwatchServer"
 * }</pre>
 * Then scrape http://localhost:3000/metrics.
 */
public class PerfwatchServer {

    public static void main(String[] args) throws InterruptedException {
        var collector = new MicrometerRequestCollector(CollectorConfig.create());
        var server = new MetricsServer(ServerConfig.fromEnvironment(), collector);
        var stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            collector.close();
            stopped.countDown();
        }, "perfwatch-shutdown"));

        server.start();
        System.out.println("""

                Perfwatch server
                ----------------
                Health:   http://localhost:%d/health
                Metrics:  http://localhost:%d/metrics
                """.formatted(server.port(), server.port()));
        stopped.await();
    }
}
