package ai.convoy.scheduler.jobs;

import jakarta.annotation.Nullable;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Per-queue backlog of submitted jobs. A job is either queued (eligible for leasing) or leased; archived
 * jobs are removed.
 */
@Singleton
public class JobRepository {
    private static final Logger LOG = LogManager.getLogger(JobRepository.class);

    private enum Status {
        QUEUED,
        LEASED
    }

    private static final class Entry {
        private final Job job;
        private Status status = Status.QUEUED;
        // cluster id -> labels the job should stay away from on that cluster
        private final Map<String, Map<String, String>> avoidLabels = new HashMap<>();

        private Entry(Job job) {
            this.job = job;
        }
    }

    private final Map<String, Entry> jobs = new HashMap<>();
    private final Map<String, LinkedHashMap<String, Entry>> queues = new HashMap<>();

    public synchronized void submit(Job job) {
        if (jobs.containsKey(job.id())) {
            throw new IllegalArgumentException("Job " + job.id() + " already exists");
        }
        var entry = new Entry(job);
        jobs.put(job.id(), entry);
        queues.computeIfAbsent(job.queue(), q -> new LinkedHashMap<>()).put(job.id(), entry);
    }

    @Nullable
    public synchronized Job get(String jobId) {
        var entry = jobs.get(jobId);
        return entry == null ? null : entry.job;
    }

    public synchronized Set<String> queues() {
        return new TreeSet<>(queues.keySet());
    }

    /**
     * Queued jobs of a queue in submission order.
     */
    public synchronized List<Job> backlog(String queue) {
        var entries = queues.get(queue);
        if (entries == null) {
            return List.of();
        }
        var result = new ArrayList<Job>();
        for (var entry : entries.values()) {
            if (entry.status == Status.QUEUED) {
                result.add(entry.job);
            }
        }
        return result;
    }

    /**
     * Atomically moves a queued job to leased.
     *
     * @return false if the job is unknown or already leased
     */
    public synchronized boolean tryLease(String jobId) {
        var entry = jobs.get(jobId);
        if (entry == null || entry.status != Status.QUEUED) {
            return false;
        }
        entry.status = Status.LEASED;
        return true;
    }

    public synchronized void requeue(String jobId) {
        var entry = jobs.get(jobId);
        if (entry == null) {
            LOG.warn("Cannot requeue unknown job {}", jobId);
            return;
        }
        entry.status = Status.QUEUED;
    }

    public synchronized void archive(String jobId) {
        var entry = jobs.remove(jobId);
        if (entry == null) {
            return;
        }
        var queue = queues.get(entry.job.queue());
        queue.remove(jobId);
        if (queue.isEmpty()) {
            queues.remove(entry.job.queue());
        }
    }

    public synchronized void avoidLabels(String jobId, String clusterId, Map<String, String> labels) {
        var entry = jobs.get(jobId);
        if (entry != null && !labels.isEmpty()) {
            entry.avoidLabels.computeIfAbsent(clusterId, c -> new HashMap<>()).putAll(labels);
        }
    }

    public synchronized Map<String, String> avoidedLabels(String jobId, String clusterId) {
        var entry = jobs.get(jobId);
        if (entry == null) {
            return Map.of();
        }
        return Map.copyOf(entry.avoidLabels.getOrDefault(clusterId, Map.of()));
    }

    public synchronized int size() {
        return jobs.size();
    }
}
