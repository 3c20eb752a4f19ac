package ai.convoy.scheduler.usage;

import io.prometheus.client.Collector;
import io.prometheus.client.GaugeMetricFamily;

import java.util.List;
import java.util.TreeMap;

/**
 * Exports the global per-queue usage at scrape time, so clusters whose report went stale drop out.
 */
public class QueueUsageCollector extends Collector {
    static final String NAME = "scheduler_queue_leased_resources";

    private final QueueUsageAggregator usage;

    public QueueUsageCollector(QueueUsageAggregator usage) {
        this.usage = usage;
    }

    @Override
    public List<MetricFamilySamples> collect() {
        var family = new GaugeMetricFamily(NAME, "Resources leased per queue over fresh cluster reports, milli-units",
            List.of("queue", "resource"));
        new TreeMap<>(usage.globalUsage()).forEach((queue, resources) -> resources.asMap()
            .forEach((resource, millis) -> family.addMetric(List.of(queue, resource), millis)));
        return List.of(family);
    }
}
