package ai.convoy.scheduler.lifecycle;

import ai.convoy.scheduler.accounting.PoolKey;
import ai.convoy.scheduler.jobs.Job;
import ai.convoy.scheduler.resources.ComputeResources;

/**
 * Binding of one job to one cluster/pool. Mutable fields are guarded by the accountant lock of the pool.
 */
public final class Lease {
    public static final long NEVER = Long.MIN_VALUE;

    private final Job job;
    private final PoolKey pool;
    private final int priorityClass;
    private final ComputeResources resources;

    private LeaseState state = LeaseState.UNISSUED;
    private long deadlineNanos;
    private long terminatedNanos = NEVER;
    private boolean acked;
    private long lastSentNanos = NEVER;
    private long batchId;
    private String sessionId;

    Lease(Job job, PoolKey pool, int priorityClass, ComputeResources resources, long batchId, String sessionId) {
        this.job = job;
        this.pool = pool;
        this.priorityClass = priorityClass;
        this.resources = resources;
        this.batchId = batchId;
        this.sessionId = sessionId;
    }

    public String jobId() {
        return job.id();
    }

    public Job job() {
        return job;
    }

    public PoolKey pool() {
        return pool;
    }

    public int priorityClass() {
        return priorityClass;
    }

    public ComputeResources resources() {
        return resources;
    }

    public LeaseState state() {
        return state;
    }

    public long deadlineNanos() {
        return deadlineNanos;
    }

    public long terminatedNanos() {
        return terminatedNanos;
    }

    public boolean acked() {
        return acked;
    }

    public long lastSentNanos() {
        return lastSentNanos;
    }

    public long batchId() {
        return batchId;
    }

    public String sessionId() {
        return sessionId;
    }

    void setState(LeaseState state, long nowNanos) {
        this.state = state;
        if (state.isTerminal()) {
            this.terminatedNanos = nowNanos;
        }
    }

    void setDeadlineNanos(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    void setAcked(boolean acked) {
        this.acked = acked;
    }

    void assignBatch(long batchId, String sessionId) {
        this.batchId = batchId;
        this.sessionId = sessionId;
    }

    void markSent(long nowNanos) {
        this.lastSentNanos = nowNanos;
    }

    @Override
    public String toString() {
        return "Lease{job=" + job.id() + ", pool=" + pool + ", state=" + state + ", acked=" + acked
            + ", batch=" + batchId + "}";
    }
}
