package ai.convoy.scheduler.oracle;

import ai.convoy.scheduler.configs.ServiceConfig;
import ai.convoy.scheduler.jobs.Job;
import ai.convoy.scheduler.jobs.JobRepository;
import ai.convoy.scheduler.resources.ComputeResources;
import ai.convoy.scheduler.usage.QueueUsageAggregator;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Offers queues in ascending order of their dominant share of the pool's capacity, one job per queue per
 * round. Within a queue jobs are ordered by the configured job order and then by submission time.
 */
@Singleton
public class UsageOrderedOracle implements FairnessOracle {
    private final JobRepository jobs;
    private final QueueUsageAggregator usage;
    private final Comparator<Job> jobOrder;

    @Inject
    public UsageOrderedOracle(JobRepository jobs, QueueUsageAggregator usage, ServiceConfig config) {
        this(jobs, usage, config.getJobOrder());
    }

    public UsageOrderedOracle(JobRepository jobs, QueueUsageAggregator usage, ServiceConfig.JobOrder order) {
        this.jobs = jobs;
        this.usage = usage;
        var byPriority = Comparator.comparingDouble(Job::priority);
        this.jobOrder = (order == ServiceConfig.JobOrder.LOWER_FIRST ? byPriority : byPriority.reversed())
            .thenComparing(Job::created)
            .thenComparing(Job::id);
    }

    @Override
    public List<Job> selectJobs(SchedulingContext context) {
        var global = usage.globalUsage();
        var largestHeadroom = largest(context.headroom().values());

        var queues = new ArrayList<>(jobs.queues());
        queues.sort(Comparator.comparingDouble((String q) -> share(global, q, context.capacity()))
            .thenComparing(Comparator.naturalOrder()));

        var candidates = new ArrayList<Deque<Job>>();
        for (var queue : queues) {
            var backlog = new ArrayList<>(jobs.backlog(queue));
            backlog.removeIf(job -> !job.resourceRequests().fitsWithin(largestHeadroom)
                || !job.resourceRequests().meetsMinimum(context.minimumJobSize()));
            if (!backlog.isEmpty()) {
                backlog.sort(jobOrder);
                candidates.add(new ArrayDeque<>(backlog));
            }
        }

        var selected = new ArrayList<Job>();
        while (selected.size() < context.maxJobs() && !candidates.isEmpty()) {
            var it = candidates.iterator();
            while (it.hasNext() && selected.size() < context.maxJobs()) {
                var queue = it.next();
                selected.add(queue.pollFirst());
                if (queue.isEmpty()) {
                    it.remove();
                }
            }
        }
        return selected;
    }

    private static double share(Map<String, ComputeResources> global, String queue, ComputeResources capacity) {
        var used = global.get(queue);
        if (used == null) {
            return 0;
        }
        double share = 0;
        for (var entry : used.asMap().entrySet()) {
            long total = capacity.get(entry.getKey());
            share = Math.max(share, total > 0 ? (double) entry.getValue() / total : Double.MAX_VALUE);
        }
        return share;
    }

    private static ComputeResources largest(Iterable<ComputeResources> vectors) {
        var result = ComputeResources.EMPTY;
        for (var vector : vectors) {
            result = result.add(vector.subtractClamped(result));
        }
        return result;
    }
}
