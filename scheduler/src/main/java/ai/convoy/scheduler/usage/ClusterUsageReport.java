package ai.convoy.scheduler.usage;

import ai.convoy.scheduler.resources.ComputeResources;
import ai.convoy.v1.QueueApi;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public record ClusterUsageReport(String clusterId, Instant reportTime, Map<String, ComputeResources> queues) {

    /**
     * @param clusterId used when the report does not name its cluster
     * @throws IllegalArgumentException if a quantity cannot be parsed
     */
    public static ClusterUsageReport fromProto(String clusterId, QueueApi.ClusterLeasedReport report) {
        var queues = new LinkedHashMap<String, ComputeResources>();
        for (var queue : report.getQueuesList()) {
            queues.merge(queue.getName(), ComputeResources.parse(queue.getResourcesLeasedMap()),
                ComputeResources::add);
        }
        var time = report.getReportTime();
        return new ClusterUsageReport(
            report.getClusterId().isEmpty() ? clusterId : report.getClusterId(),
            Instant.ofEpochSecond(time.getSeconds(), time.getNanos()),
            Map.copyOf(queues));
    }
}
