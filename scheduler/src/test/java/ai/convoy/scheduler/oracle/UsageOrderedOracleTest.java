package ai.convoy.scheduler.oracle;

import ai.convoy.scheduler.SchedulerHarness;
import ai.convoy.scheduler.configs.ServiceConfig;
import ai.convoy.scheduler.jobs.Job;
import ai.convoy.scheduler.resources.ComputeResources;
import ai.convoy.scheduler.usage.ClusterUsageReport;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static ai.convoy.scheduler.SchedulerHarness.POOL;
import static ai.convoy.scheduler.SchedulerHarness.cpu;

public class UsageOrderedOracleTest {
    private final SchedulerHarness h = new SchedulerHarness();

    @After
    public void tearDown() {
        h.close();
    }

    private static SchedulingContext context(String headroom, String minimum, int maxJobs) {
        var byPriority = new TreeMap<Integer, ComputeResources>();
        byPriority.put(0, cpu(headroom));
        return new SchedulingContext(POOL, cpu("10"), byPriority, List.of(),
            minimum.isEmpty() ? ComputeResources.EMPTY : cpu(minimum), maxJobs);
    }

    private static List<String> ids(List<Job> jobs) {
        return jobs.stream().map(Job::id).toList();
    }

    @Test
    public void testLeastUsedQueueFirstRoundRobin() throws Exception {
        h.submit("a1", "qa", "1");
        h.submit("a2", "qa", "1");
        h.submit("b1", "qb", "1");
        h.submit("b2", "qb", "1");
        h.submit("c1", "qc", "1");
        h.usage.update(new ClusterUsageReport("cluster-b", h.clock.instant(),
            Map.of("qa", cpu("6"), "qb", cpu("2"))));

        var oracle = new UsageOrderedOracle(h.jobs, h.usage, ServiceConfig.JobOrder.LOWER_FIRST);

        Assert.assertEquals(List.of("c1", "b1", "a1", "b2", "a2"), ids(oracle.selectJobs(context("10", "", 10))));
        Assert.assertEquals(List.of("c1", "b1"), ids(oracle.selectJobs(context("10", "", 2))));
    }

    @Test
    public void testJobOrderWithinQueue() throws Exception {
        var early = h.job("early", "q1", "1", "");
        var late = h.job("late", "q1", "1", "");
        h.submit(withPriority(early, 5));
        h.submit(withPriority(late, 1));

        var lowerFirst = new UsageOrderedOracle(h.jobs, h.usage, ServiceConfig.JobOrder.LOWER_FIRST);
        var higherFirst = new UsageOrderedOracle(h.jobs, h.usage, ServiceConfig.JobOrder.HIGHER_FIRST);

        Assert.assertEquals(List.of("late", "early"), ids(lowerFirst.selectJobs(context("10", "", 10))));
        Assert.assertEquals(List.of("early", "late"), ids(higherFirst.selectJobs(context("10", "", 10))));
    }

    @Test
    public void testSkipsJobsThatCannotFit() throws Exception {
        h.submit("huge", "q1", "12");
        h.submit("tiny", "q1", "100m");
        h.submit("ok", "q1", "2");

        var oracle = new UsageOrderedOracle(h.jobs, h.usage, ServiceConfig.JobOrder.LOWER_FIRST);

        Assert.assertEquals(List.of("ok"), ids(oracle.selectJobs(context("10", "1", 10))));
        Assert.assertEquals(List.of(), ids(oracle.selectJobs(context("1", "1", 10))));
    }

    private static Job withPriority(Job job, double priority) {
        return new Job(job.id(), job.clientId(), job.queue(), job.jobSetId(), job.namespace(), job.owner(), priority,
            job.created(), job.scheduler(), job.labels(), job.annotations(), job.requiredNodeLabels(),
            job.resourceRequests(), job.tolerations(), job.priorityClassName());
    }
}
