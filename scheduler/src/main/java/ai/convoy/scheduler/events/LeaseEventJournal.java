package ai.convoy.scheduler.events;

import ai.convoy.scheduler.lifecycle.Lease;
import ai.convoy.scheduler.lifecycle.LeaseState;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Recent lease transitions keyed by job-set handle. Bounded; the oldest events are dropped first.
 */
@Singleton
public class LeaseEventJournal {
    private static final Logger LOG = LogManager.getLogger(LeaseEventJournal.class);

    public static final int DEFAULT_CAPACITY = 10_000;

    private final JobSetIdMapper jobSets;
    private final Clock clock;
    private final int capacity;
    private final Deque<LeaseEvent> events = new ArrayDeque<>();

    @Inject
    public LeaseEventJournal(JobSetIdMapper jobSets, Clock clock) {
        this(jobSets, clock, DEFAULT_CAPACITY);
    }

    public LeaseEventJournal(JobSetIdMapper jobSets, Clock clock, int capacity) {
        this.jobSets = jobSets;
        this.clock = clock;
        this.capacity = capacity;
    }

    public void record(Lease lease, LeaseState state) {
        long handle;
        try {
            handle = jobSets.get(lease.job().queue(), lease.job().jobSetId());
        } catch (SQLException e) {
            LOG.error("Cannot record {} of lease {}: job set handle unavailable", state, lease.jobId(), e);
            return;
        }
        var event = new LeaseEvent(handle, lease.jobId(), lease.pool().clusterId(), state, clock.instant());
        synchronized (events) {
            if (events.size() == capacity) {
                events.removeFirst();
            }
            events.addLast(event);
        }
    }

    public List<LeaseEvent> eventsOf(long jobSetHandle) {
        synchronized (events) {
            return events.stream().filter(e -> e.jobSetHandle() == jobSetHandle).toList();
        }
    }

    public List<LeaseEvent> eventsOfJob(String jobId) {
        synchronized (events) {
            return events.stream().filter(e -> e.jobId().equals(jobId)).toList();
        }
    }
}
