package ai.convoy.scheduler.nodes;

import ai.convoy.scheduler.resources.ComputeResources;

import java.util.Collections;
import java.util.SortedMap;

/**
 * Aggregate of all reported nodes sharing one {@link NodeType}.
 *
 * @param availableByPriority for every configured priority class, resources available to that class summed
 *                            over the group's nodes
 */
public record NodeTypeGroup(
    NodeType nodeType,
    int nodeCount,
    ComputeResources allocatable,
    SortedMap<Integer, ComputeResources> availableByPriority
) {
    public NodeTypeGroup {
        availableByPriority = Collections.unmodifiableSortedMap(availableByPriority);
    }

    public ComputeResources availableAt(int priority) {
        var exact = availableByPriority.get(priority);
        if (exact != null) {
            return exact;
        }
        // closest configured class at or above the requested one
        var above = availableByPriority.tailMap(priority);
        return above.isEmpty() ? ComputeResources.EMPTY : above.get(above.firstKey());
    }
}
