package ai.convoy.scheduler.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.HTTPServer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Serves the registry in Prometheus text format on {@code /metrics}.
 */
public final class PrometheusMetricReporter implements MetricReporter {
    private static final Logger LOG = LogManager.getLogger(PrometheusMetricReporter.class);

    private final int port;
    private final CollectorRegistry registry;
    private HTTPServer server;

    public PrometheusMetricReporter(int port, CollectorRegistry registry) {
        this.port = port;
        this.registry = registry;
    }

    @Override
    public synchronized void start() {
        if (server != null) {
            throw new IllegalStateException("Prometheus endpoint is already running on port " + port);
        }
        try {
            server = new HTTPServer.Builder()
                .withPort(port)
                .withRegistry(registry)
                .withDaemonThreads(true)
                .build();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot expose metrics on port " + port, e);
        }
        LOG.info("Metrics are exposed on port {}", port);
    }

    @Override
    public synchronized void stop() {
        if (server != null) {
            server.close();
            server = null;
        }
    }
}
