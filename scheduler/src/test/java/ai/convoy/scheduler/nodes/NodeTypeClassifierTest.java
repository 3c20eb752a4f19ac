package ai.convoy.scheduler.nodes;

import ai.convoy.scheduler.resources.ComputeResources;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

public class NodeTypeClassifierTest {
    private static final String HOSTNAME = "kubernetes.io/hostname";

    private final NodeTypeClassifier classifier = new NodeTypeClassifier(List.of(HOSTNAME), List.of(0, 1000));

    private static ComputeResources cpu(String amount) {
        return ComputeResources.of("cpu", amount);
    }

    private static NodeInfo node(String name, List<Taint> taints, Map<String, String> labels, String allocatable,
                                 Map<Integer, String> allocated)
    {
        var byPriority = new TreeMap<Integer, ComputeResources>();
        allocated.forEach((priority, amount) -> byPriority.put(priority, cpu(amount)));
        var withHost = new TreeMap<>(labels);
        withHost.put(HOSTNAME, name);
        return new NodeInfo(name, taints, withHost, cpu(allocatable), cpu(allocatable), byPriority);
    }

    @Test
    public void testEquivalentNodesShareType() {
        var gpuTaint = new Taint("nvidia.com/gpu", "true", Taint.NO_SCHEDULE);
        var spotTaint = new Taint("spot", "true", Taint.NO_EXECUTE);

        var a = node("a", List.of(gpuTaint, spotTaint), Map.of("zone", "a"), "8", Map.of());
        var b = node("b", List.of(spotTaint, gpuTaint), Map.of("zone", "a"), "8", Map.of());
        var c = node("c", List.of(gpuTaint), Map.of("zone", "a"), "8", Map.of());
        var d = node("d", List.of(gpuTaint, spotTaint), Map.of("zone", "b"), "8", Map.of());
        var e = node("e", List.of(gpuTaint, spotTaint), Map.of("zone", "a"), "16", Map.of());

        var groups = classifier.classify(List.of(a, b, c, d, e));

        Assert.assertEquals(4, groups.size());
        var shared = groups.get(NodeType.of(a, List.of(HOSTNAME)));
        Assert.assertNotNull(shared);
        Assert.assertEquals(2, shared.nodeCount());
        Assert.assertEquals(NodeType.of(a, List.of(HOSTNAME)), NodeType.of(b, List.of(HOSTNAME)));
        Assert.assertEquals(cpu("16"), shared.allocatable());
    }

    @Test
    public void testIgnoredLabelsDoNotSplitTypes() {
        var keepingHostname = new NodeTypeClassifier(List.of(), List.of(0));
        var nodes = List.of(
            node("a", List.of(), Map.of(), "4", Map.of()),
            node("b", List.of(), Map.of(), "4", Map.of()));

        Assert.assertEquals(1, classifier.classify(nodes).size());
        Assert.assertEquals(2, keepingHostname.classify(nodes).size());
    }

    @Test
    public void testResultDoesNotDependOnOrder() {
        var nodes = new ArrayList<NodeInfo>();
        for (int i = 0; i < 20; i++) {
            nodes.add(node("n" + i, i % 3 == 0 ? List.of(new Taint("k", "v", Taint.NO_SCHEDULE)) : List.of(),
                Map.of("pool", "p" + (i % 4)), "8", Map.of(0, "1", 1000, String.valueOf(i % 2))));
        }
        var expected = classifier.classify(nodes);

        var random = new Random(42);
        for (int round = 0; round < 10; round++) {
            Collections.shuffle(nodes, random);
            var actual = classifier.classify(nodes);
            Assert.assertEquals(expected, actual);
            Assert.assertEquals(new ArrayList<>(expected.keySet()), new ArrayList<>(actual.keySet()));
        }
    }

    @Test
    public void testAvailabilityPerPriority() {
        // 8 cpu, 2 held by class 0 and 3 by class 1000
        var n1 = node("n1", List.of(), Map.of(), "8", Map.of(0, "2", 1000, "3"));
        var n2 = node("n2", List.of(), Map.of(), "8", Map.of());

        var group = classifier.classify(List.of(n1, n2)).values().iterator().next();

        Assert.assertEquals(cpu("3"), n1.availableAt(0));
        Assert.assertEquals(cpu("5"), n1.availableAt(1000));
        Assert.assertEquals(cpu("11"), group.availableAt(0));
        Assert.assertEquals(cpu("13"), group.availableAt(1000));
    }

    @Test
    public void testTolerationsAndLabels() {
        var type = NodeType.of(node("a",
            List.of(new Taint("gpu", "true", Taint.NO_SCHEDULE), new Taint("soft", "x", "PreferNoSchedule")),
            Map.of("zone", "a"), "8", Map.of()), List.of(HOSTNAME));

        Assert.assertFalse(type.tolerates(List.of()));
        Assert.assertTrue(type.tolerates(List.of(new Toleration("gpu", "Equal", "true", ""))));
        Assert.assertFalse(type.tolerates(List.of(new Toleration("gpu", "Equal", "false", ""))));
        Assert.assertTrue(type.tolerates(List.of(new Toleration("gpu", Toleration.EXISTS, "", Taint.NO_SCHEDULE))));
        Assert.assertFalse(type.tolerates(List.of(new Toleration("gpu", Toleration.EXISTS, "", Taint.NO_EXECUTE))));
        Assert.assertTrue(type.tolerates(List.of(new Toleration("", Toleration.EXISTS, "", ""))));

        Assert.assertTrue(type.hasLabels(Map.of("zone", "a")));
        Assert.assertFalse(type.hasLabels(Map.of("zone", "b")));
        Assert.assertFalse(type.hasLabels(Map.of(HOSTNAME, "a")));
        Assert.assertTrue(type.matchesAny(Map.of("zone", "a", "rack", "r1")));
        Assert.assertFalse(type.matchesAny(Map.of("rack", "r1")));
    }
}
