package ai.convoy.scheduler.nodes;

import ai.convoy.scheduler.resources.ComputeResources;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Scheduling-equivalence key of a node. Taints and labels are held sorted, so the key does not depend on
 * the order in which they were reported.
 */
public record NodeType(SortedSet<Taint> taints, SortedMap<String, String> labels, ComputeResources allocatable) {

    public static NodeType of(NodeInfo node, Collection<String> ignoredLabels) {
        var labels = new TreeMap<>(node.labels());
        labels.keySet().removeAll(ignoredLabels);
        return new NodeType(
            Collections.unmodifiableSortedSet(new TreeSet<>(node.taints())),
            Collections.unmodifiableSortedMap(labels),
            node.allocatable());
    }

    public boolean tolerates(Collection<Toleration> tolerations) {
        for (var taint : taints) {
            if (taint.isHard() && tolerations.stream().noneMatch(t -> t.tolerates(taint))) {
                return false;
            }
        }
        return true;
    }

    public boolean hasLabels(Map<String, String> required) {
        for (var entry : required.entrySet()) {
            if (!entry.getValue().equals(labels.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    /**
     * True iff any of the given labels is present on this node type with the same value.
     */
    public boolean matchesAny(Map<String, String> avoided) {
        for (var entry : avoided.entrySet()) {
            if (entry.getValue().equals(labels.get(entry.getKey()))) {
                return true;
            }
        }
        return false;
    }
}
