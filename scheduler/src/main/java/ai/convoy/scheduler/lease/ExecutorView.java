package ai.convoy.scheduler.lease;

import ai.convoy.scheduler.accounting.PoolKey;
import ai.convoy.scheduler.nodes.NodeInfo;
import ai.convoy.scheduler.resources.ComputeResources;
import ai.convoy.scheduler.usage.ClusterUsageReport;
import ai.convoy.v1.QueueApi;
import jakarta.annotation.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Latest capacity report of one executor connection. Fields left empty in a message keep the last non-empty
 * value received.
 */
public final class ExecutorView {
    private String clusterId = "";
    private String pool = "";
    private ComputeResources resources = ComputeResources.EMPTY;
    @Nullable
    private ClusterUsageReport usageReport;
    private ComputeResources minimumJobSize = ComputeResources.EMPTY;
    private List<NodeInfo> nodes = List.of();

    /**
     * @throws IllegalArgumentException if a quantity cannot be parsed
     */
    public static ExecutorView of(QueueApi.LeaseRequest request) {
        var view = new ExecutorView();
        view.apply(request.getClusterId(), request.getPool(), request.getResourcesMap(),
            request.hasClusterLeasedReport() ? request.getClusterLeasedReport() : null,
            request.getMinimumJobSizeMap(), request.getNodesList());
        return view;
    }

    /**
     * @throws IllegalArgumentException if a quantity cannot be parsed, or the message names another cluster or
     *                                  pool than earlier ones
     */
    public void merge(QueueApi.StreamingLeaseRequest request) {
        if (!clusterId.isEmpty() && !request.getClusterId().isEmpty() && !clusterId.equals(request.getClusterId())) {
            throw new IllegalArgumentException("Cluster id changed from " + clusterId + " to "
                + request.getClusterId() + " within one stream");
        }
        if (!pool.isEmpty() && !request.getPool().isEmpty() && !pool.equals(request.getPool())) {
            throw new IllegalArgumentException("Pool changed from " + pool + " to " + request.getPool()
                + " within one stream");
        }
        apply(request.getClusterId(), request.getPool(), request.getResourcesMap(),
            request.hasClusterLeasedReport() ? request.getClusterLeasedReport() : null,
            request.getMinimumJobSizeMap(), request.getNodesList());
    }

    private void apply(String newClusterId, String newPool, Map<String, String> newResources,
                       @Nullable QueueApi.ClusterLeasedReport newReport, Map<String, String> newMinimum,
                       List<QueueApi.NodeInfo> newNodes)
    {
        var effectiveCluster = newClusterId.isEmpty() ? clusterId : newClusterId;

        // parse everything first so a malformed message changes nothing
        var parsedResources = newResources.isEmpty() ? null : ComputeResources.parse(newResources);
        var parsedReport = newReport == null ? null : ClusterUsageReport.fromProto(effectiveCluster, newReport);
        var parsedMinimum = newMinimum.isEmpty() ? null : ComputeResources.parse(newMinimum);
        var parsedNodes = newNodes.isEmpty() ? null : newNodes.stream().map(NodeInfo::fromProto).toList();

        clusterId = effectiveCluster;
        if (!newPool.isEmpty()) {
            pool = newPool;
        }
        if (parsedResources != null) {
            resources = parsedResources;
        }
        if (parsedReport != null) {
            usageReport = parsedReport;
        }
        if (parsedMinimum != null) {
            minimumJobSize = parsedMinimum;
        }
        if (parsedNodes != null) {
            nodes = parsedNodes;
        }
    }

    public String clusterId() {
        return clusterId;
    }

    public PoolKey poolKey() {
        return new PoolKey(clusterId, pool);
    }

    public ComputeResources resources() {
        return resources;
    }

    @Nullable
    public ClusterUsageReport usageReport() {
        return usageReport;
    }

    public ComputeResources minimumJobSize() {
        return minimumJobSize;
    }

    public List<NodeInfo> nodes() {
        return nodes;
    }

    /**
     * Sum of node allocatable resources, or the reported total when the executor sent no nodes.
     */
    public ComputeResources capacity() {
        if (nodes.isEmpty()) {
            return resources;
        }
        var total = ComputeResources.EMPTY;
        for (var node : nodes) {
            total = total.add(node.allocatable());
        }
        return total;
    }
}
