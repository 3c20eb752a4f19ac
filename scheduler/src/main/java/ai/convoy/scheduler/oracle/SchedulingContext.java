package ai.convoy.scheduler.oracle;

import ai.convoy.scheduler.accounting.PoolKey;
import ai.convoy.scheduler.nodes.NodeTypeGroup;
import ai.convoy.scheduler.resources.ComputeResources;

import java.util.Collection;
import java.util.SortedMap;

/**
 * What the oracle may know about the pool asking for work.
 *
 * @param headroom per configured priority class, what the accountant would still admit
 */
public record SchedulingContext(
    PoolKey pool,
    ComputeResources capacity,
    SortedMap<Integer, ComputeResources> headroom,
    Collection<NodeTypeGroup> nodeTypes,
    ComputeResources minimumJobSize,
    int maxJobs
) {
}
