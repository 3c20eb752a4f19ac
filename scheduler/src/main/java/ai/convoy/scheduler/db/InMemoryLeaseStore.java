package ai.convoy.scheduler.db;

import ai.convoy.scheduler.jobs.Job;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Singleton
@Requires(property = "scheduler.database.enabled", notEquals = "true")
public class InMemoryLeaseStore implements LeaseStore {
    private final Map<String, JobRecord> jobs = new LinkedHashMap<>();
    private final Map<String, LeaseRecord> leases = new LinkedHashMap<>();

    @Override
    public synchronized void saveJobs(Collection<Job> toSave) {
        for (var job : toSave) {
            jobs.putIfAbsent(job.id(), new JobRecord(job, false));
        }
    }

    @Override
    public synchronized void archiveJobs(Collection<String> jobIds) {
        for (var id : jobIds) {
            jobs.computeIfPresent(id, (k, record) -> new JobRecord(record.job(), true));
        }
    }

    @Override
    public synchronized void saveLeases(Collection<LeaseRecord> toSave) {
        for (var lease : toSave) {
            leases.put(lease.jobId(), lease);
        }
    }

    @Override
    public synchronized void deleteTerminalLeases(Collection<String> jobIds) {
        for (var id : jobIds) {
            var lease = leases.get(id);
            if (lease != null && !lease.state().isLive()) {
                leases.remove(id);
            }
        }
    }

    @Override
    public synchronized List<Job> loadJobs() {
        return jobs.values().stream()
            .filter(record -> !record.archived())
            .map(JobRecord::job)
            .sorted(Comparator.comparing(Job::created))
            .toList();
    }

    @Override
    public synchronized List<LeaseRecord> loadLiveLeases() {
        var result = new ArrayList<LeaseRecord>();
        for (var lease : leases.values()) {
            if (lease.state().isLive()) {
                result.add(lease);
            }
        }
        return result;
    }
}
