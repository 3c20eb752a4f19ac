package ai.convoy.scheduler.jobs;

import ai.convoy.scheduler.SchedulerHarness;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

public class JobRepositoryTest {
    private final SchedulerHarness h = new SchedulerHarness();
    private final JobRepository jobs = new JobRepository();

    @After
    public void tearDown() {
        h.close();
    }

    @Test
    public void testLeaseAndRequeue() {
        jobs.submit(h.job("j1", "q1", "1", ""));
        jobs.submit(h.job("j2", "q1", "1", ""));
        jobs.submit(h.job("j3", "q2", "1", ""));

        Assert.assertEquals(Set.of("q1", "q2"), jobs.queues());
        Assert.assertTrue(jobs.tryLease("j1"));
        Assert.assertFalse(jobs.tryLease("j1"));
        Assert.assertFalse(jobs.tryLease("unknown"));
        Assert.assertEquals(List.of("j2"), ids(jobs.backlog("q1")));

        jobs.requeue("j1");
        Assert.assertEquals(List.of("j1", "j2"), ids(jobs.backlog("q1")));
    }

    @Test
    public void testArchiveRemovesEmptyQueue() {
        jobs.submit(h.job("j1", "q1", "1", ""));
        jobs.archive("j1");
        jobs.archive("j1");

        Assert.assertNull(jobs.get("j1"));
        Assert.assertTrue(jobs.queues().isEmpty());
        Assert.assertEquals(0, jobs.size());
        Assert.assertThrows(IllegalArgumentException.class, () -> {
            jobs.submit(h.job("j2", "q1", "1", ""));
            jobs.submit(h.job("j2", "q1", "1", ""));
        });
    }

    @Test
    public void testAvoidedLabelsPerCluster() {
        jobs.submit(h.job("j1", "q1", "1", ""));
        jobs.avoidLabels("j1", "cluster-a", Map.of("zone", "a"));
        jobs.avoidLabels("j1", "cluster-a", Map.of("rack", "r1"));
        jobs.avoidLabels("missing", "cluster-a", Map.of("zone", "a"));

        Assert.assertEquals(Map.of("zone", "a", "rack", "r1"), jobs.avoidedLabels("j1", "cluster-a"));
        Assert.assertEquals(Map.of(), jobs.avoidedLabels("j1", "cluster-b"));
        Assert.assertEquals(Map.of(), jobs.avoidedLabels("missing", "cluster-a"));
    }

    private static List<String> ids(List<Job> jobs) {
        return jobs.stream().map(Job::id).toList();
    }
}
