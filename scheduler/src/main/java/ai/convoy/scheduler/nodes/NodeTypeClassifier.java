package ai.convoy.scheduler.nodes;

import ai.convoy.scheduler.resources.ComputeResources;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Groups nodes into scheduling-equivalence classes. Stateless: the result depends only on the set of nodes,
 * not on their order.
 */
public class NodeTypeClassifier {
    private final Set<String> ignoredLabels;
    private final SortedSet<Integer> priorities;

    public NodeTypeClassifier(Collection<String> ignoredLabels, Collection<Integer> priorities) {
        this.ignoredLabels = Set.copyOf(ignoredLabels);
        this.priorities = new TreeSet<>(priorities);
    }

    /**
     * @return groups keyed by node type, iterated in a deterministic order independent of input order
     */
    public Map<NodeType, NodeTypeGroup> classify(Collection<NodeInfo> nodes) {
        var byType = new HashMap<NodeType, List<NodeInfo>>();
        for (var node : nodes) {
            byType.computeIfAbsent(NodeType.of(node, ignoredLabels), k -> new ArrayList<>()).add(node);
        }

        var result = new LinkedHashMap<NodeType, NodeTypeGroup>();
        byType.entrySet().stream()
            .sorted(Comparator.comparing(entry -> entry.getKey().toString()))
            .forEach(entry -> result.put(entry.getKey(), group(entry.getKey(), entry.getValue())));
        return result;
    }

    private NodeTypeGroup group(NodeType type, List<NodeInfo> members) {
        var available = new TreeMap<Integer, ComputeResources>();
        for (int priority : priorities) {
            var sum = ComputeResources.EMPTY;
            for (var node : members) {
                sum = sum.add(node.availableAt(priority));
            }
            available.put(priority, sum);
        }
        return new NodeTypeGroup(type, members.size(), type.allocatable().multiply(members.size()), available);
    }
}
