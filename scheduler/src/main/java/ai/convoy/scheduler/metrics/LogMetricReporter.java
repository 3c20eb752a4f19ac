package ai.convoy.scheduler.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

/**
 * Writes the whole registry to a logger once, on stop.
 */
public final class LogMetricReporter implements MetricReporter {
    private final Logger log;
    private final Level level;
    private final CollectorRegistry registry;

    public LogMetricReporter(String loggerName, Level level, CollectorRegistry registry) {
        this.log = LogManager.getLogger(loggerName);
        this.level = level;
        this.registry = registry;
    }

    @Override
    public void start() {
    }

    @Override
    public void stop() {
        log.log(level, report());
    }

    String report() {
        var writer = new StringWriter();
        try {
            TextFormat.write004(writer, registry.metricFamilySamples());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }
}
