package ai.convoy.scheduler.nodes;

import ai.convoy.scheduler.resources.ComputeResources;
import ai.convoy.v1.QueueApi;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Node as reported by an executor.
 *
 * @param allocatedByPriority priority class value to resources held by pods of that class; empty when the
 *                            executor does not report per-priority allocation
 */
public record NodeInfo(
    String name,
    List<Taint> taints,
    Map<String, String> labels,
    ComputeResources allocatable,
    ComputeResources available,
    SortedMap<Integer, ComputeResources> allocatedByPriority
) {
    /**
     * @throws IllegalArgumentException if a quantity cannot be parsed
     */
    public static NodeInfo fromProto(QueueApi.NodeInfo node) {
        var allocated = new TreeMap<Integer, ComputeResources>();
        node.getAllocatedResourcesMap().forEach(
            (priority, resources) -> allocated.put(priority, ComputeResources.parse(resources.getResourcesMap())));

        return new NodeInfo(
            node.getName(),
            node.getTaintsList().stream().map(Taint::fromProto).toList(),
            Map.copyOf(node.getLabelsMap()),
            ComputeResources.parse(node.getAllocatableResourcesMap()),
            ComputeResources.parse(node.getAvailableResourcesMap()),
            allocated);
    }

    /**
     * Resources a job of class {@code priority} may use on this node: allocatable minus everything held by
     * classes of equal or higher priority, or the reported available resources when there is no per-priority
     * breakdown.
     */
    public ComputeResources availableAt(int priority) {
        if (allocatedByPriority.isEmpty()) {
            return available;
        }
        var held = ComputeResources.EMPTY;
        for (var entry : allocatedByPriority.tailMap(priority).entrySet()) {
            held = held.add(entry.getValue());
        }
        return allocatable.subtractClamped(held);
    }
}
