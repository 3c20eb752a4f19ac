package ai.convoy.scheduler.usage;

import ai.convoy.scheduler.configs.ServiceConfig;
import ai.convoy.scheduler.resources.ComputeResources;
import io.prometheus.client.CollectorRegistry;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-queue resource usage reported by executors, one report per cluster. A newer report replaces the
 * previous one of its cluster, an older one is ignored; reports are never merged.
 */
@Singleton
public class QueueUsageAggregator {
    private static final Logger LOG = LogManager.getLogger(QueueUsageAggregator.class);

    private final Map<String, ClusterUsageReport> reports = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration reportTtl;

    @Inject
    public QueueUsageAggregator(ServiceConfig config, Clock clock, CollectorRegistry registry) {
        this(clock, config.getClusterReportTtl());
        new QueueUsageCollector(this).register(registry);
    }

    public QueueUsageAggregator(Clock clock, Duration reportTtl) {
        this.clock = clock;
        this.reportTtl = reportTtl;
    }

    /**
     * @return true if the report became the current one of its cluster
     */
    public boolean update(ClusterUsageReport report) {
        var accepted = new boolean[] {false};
        reports.compute(report.clusterId(), (id, current) -> {
            if (current != null && report.reportTime().isBefore(current.reportTime())) {
                return current;
            }
            accepted[0] = true;
            return report;
        });
        if (!accepted[0]) {
            LOG.debug("Ignore stale usage report of cluster {} at {}", report.clusterId(), report.reportTime());
        }
        return accepted[0];
    }

    /**
     * Usage per queue summed over every cluster whose report is still fresh.
     */
    public Map<String, ComputeResources> globalUsage() {
        var cutoff = clock.instant().minus(reportTtl);
        var result = new HashMap<String, ComputeResources>();
        for (var report : reports.values()) {
            if (report.reportTime().isBefore(cutoff)) {
                continue;
            }
            report.queues().forEach((queue, usage) -> result.merge(queue, usage, ComputeResources::add));
        }
        return result;
    }
}
