package ai.convoy.scheduler.metrics;

import ai.convoy.scheduler.lifecycle.LeaseState;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import jakarta.inject.Singleton;

@Singleton
public class LeaseMetrics {
    private static final String SCHEDULER = "scheduler";
    private static final String CLUSTER_LABEL = "cluster";

    private final Counter leaseTransitions;
    private final Gauge liveLeases;
    private final Gauge openSessions;
    private final Counter rejectedSessions;
    private final Counter batches;
    private final Counter resentLeases;
    private final Counter submittedJobs;

    public LeaseMetrics(CollectorRegistry registry) {
        leaseTransitions = Counter
            .build("lease_transitions", "Lease state transitions")
            .subsystem(SCHEDULER)
            .labelNames(CLUSTER_LABEL, "state")
            .register(registry);

        liveLeases = Gauge
            .build("live_leases", "Leases in state ISSUED or RENEWED")
            .subsystem(SCHEDULER)
            .labelNames(CLUSTER_LABEL)
            .register(registry);

        openSessions = Gauge
            .build("open_sessions", "Open streaming lease sessions")
            .subsystem(SCHEDULER)
            .register(registry);

        rejectedSessions = Counter
            .build("rejected_sessions", "Lease sessions and one-shot calls refused")
            .subsystem(SCHEDULER)
            .labelNames("reason")
            .register(registry);

        batches = Counter
            .build("lease_batches", "Lease batches sent to executors")
            .subsystem(SCHEDULER)
            .labelNames(CLUSTER_LABEL)
            .register(registry);

        resentLeases = Counter
            .build("resent_leases", "Leases sent again to an executor")
            .subsystem(SCHEDULER)
            .labelNames(CLUSTER_LABEL)
            .register(registry);

        submittedJobs = Counter
            .build("submitted_jobs", "Jobs accepted by Submit")
            .subsystem(SCHEDULER)
            .labelNames("queue")
            .register(registry);
    }

    public void transition(String clusterId, LeaseState state) {
        leaseTransitions.labels(clusterId, state.name()).inc();
        if (state == LeaseState.ISSUED) {
            liveLeases.labels(clusterId).inc();
        } else if (state.isTerminal()) {
            liveLeases.labels(clusterId).dec();
        }
    }

    /**
     * Undo of an issue whose batch was rolled back.
     */
    public void issueRolledBack(String clusterId) {
        liveLeases.labels(clusterId).dec();
    }

    public void sessionOpened() {
        openSessions.inc();
    }

    public void sessionClosed() {
        openSessions.dec();
    }

    public void sessionRejected(String reason) {
        rejectedSessions.labels(reason).inc();
    }

    public void batchSent(String clusterId, int resent) {
        batches.labels(clusterId).inc();
        if (resent > 0) {
            resentLeases.labels(clusterId).inc(resent);
        }
    }

    public void jobsSubmitted(String queue, int count) {
        submittedJobs.labels(queue).inc(count);
    }

    public double transitions(String clusterId, LeaseState state) {
        return leaseTransitions.labels(clusterId, state.name()).get();
    }
}
