package ai.convoy.scheduler.lifecycle;

import ai.convoy.scheduler.accounting.PoolKey;
import ai.convoy.scheduler.accounting.PriorityResourceAccountant;
import ai.convoy.scheduler.accounting.ResourceAccounting;
import ai.convoy.scheduler.configs.ServiceConfig;
import ai.convoy.scheduler.db.LeaseRecord;
import ai.convoy.scheduler.db.LeaseStore;
import ai.convoy.scheduler.events.LeaseEventJournal;
import ai.convoy.scheduler.jobs.Job;
import ai.convoy.scheduler.jobs.JobRepository;
import ai.convoy.scheduler.metrics.LeaseMetrics;
import com.google.common.base.Ticker;
import jakarta.annotation.Nullable;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owner of every lease, independent of the connection that delivered it.
 *
 * <p>All mutations of a lease happen while holding the accountant of its pool, so accounting and lease
 * state change together. Terminal transitions are written to the store before they are applied in memory;
 * a failed write leaves the lease untouched.
 *
 * <p>Deadlines are read from a monotonic {@link Ticker}.
 */
@Singleton
public class LeaseLifecycleManager {
    private static final Logger LOG = LogManager.getLogger(LeaseLifecycleManager.class);
    private static final Comparator<Lease> LIVE_ORDER = Comparator.comparingLong(Lease::batchId)
        .thenComparing(lease -> lease.job().created())
        .thenComparing(Lease::jobId);

    private final Map<String, Lease> leases = new ConcurrentHashMap<>();
    private final AtomicLong batchIds = new AtomicLong();

    private final ResourceAccounting accounting;
    private final JobRepository jobs;
    private final LeaseStore store;
    private final LeaseEventJournal journal;
    private final LeaseMetrics metrics;
    private final Ticker ticker;
    private final Clock clock;
    private final long leaseTtlNanos;
    private final long retentionNanos;

    @Inject
    public LeaseLifecycleManager(ServiceConfig config, ResourceAccounting accounting, JobRepository jobs,
                                 LeaseStore store, LeaseEventJournal journal, LeaseMetrics metrics, Ticker ticker,
                                 Clock clock)
    {
        this(accounting, jobs, store, journal, metrics, ticker, clock, config.getLeaseTtl(),
            config.getTerminalLeaseRetention());
    }

    public LeaseLifecycleManager(ResourceAccounting accounting, JobRepository jobs, LeaseStore store,
                                 LeaseEventJournal journal, LeaseMetrics metrics, Ticker ticker, Clock clock,
                                 Duration leaseTtl, Duration terminalRetention)
    {
        this.accounting = accounting;
        this.jobs = jobs;
        this.store = store;
        this.journal = journal;
        this.metrics = metrics;
        this.ticker = ticker;
        this.clock = clock;
        this.leaseTtlNanos = leaseTtl.toNanos();
        this.retentionNanos = terminalRetention.toNanos();
    }

    public long nextBatchId() {
        return batchIds.incrementAndGet();
    }

    public long now() {
        return ticker.read();
    }

    @Nullable
    public Lease get(String jobId) {
        return leases.get(jobId);
    }

    /**
     * Leases the job to the pool and commits its resources. The caller holds the accountant lock and has
     * checked {@link PriorityResourceAccountant#canAdmit}.
     *
     * @return null if the job is no longer queued
     */
    @Nullable
    public Lease issue(PriorityResourceAccountant accountant, Job job, int priorityClass, long batchId,
                       String sessionId)
    {
        if (!jobs.tryLease(job.id())) {
            return null;
        }
        try {
            accountant.commit(priorityClass, job.resourceRequests());
        } catch (IllegalStateException e) {
            jobs.requeue(job.id());
            throw e;
        }

        var lease = new Lease(job, accountant.pool(), priorityClass, job.resourceRequests(), batchId, sessionId);
        long now = ticker.read();
        lease.setState(LeaseState.ISSUED, now);
        lease.setDeadlineNanos(now + leaseTtlNanos);
        leases.put(job.id(), lease);

        metrics.transition(lease.pool().clusterId(), LeaseState.ISSUED);
        journal.record(lease, LeaseState.ISSUED);
        return lease;
    }

    /**
     * Writes freshly issued leases to the store. On failure the leases are rolled back and the error is
     * rethrown.
     */
    public void persistIssued(List<Lease> issued) throws SQLException {
        if (issued.isEmpty()) {
            return;
        }
        var records = new ArrayList<LeaseRecord>(issued.size());
        for (var lease : issued) {
            synchronized (accounting.accountant(lease.pool())) {
                records.add(record(lease, lease.state()));
            }
        }
        try {
            store.saveLeases(records);
        } catch (SQLException e) {
            LOG.error("Cannot persist {} issued leases, rolling back", issued.size(), e);
            rollback(issued);
            throw e;
        }
        LOG.info("Issued {} leases: {}", issued.size(), issued.stream().map(Lease::jobId).toList());
    }

    /**
     * Forgets issued leases that were never persisted: releases their resources and queues their jobs again.
     */
    public void rollback(Collection<Lease> issued) {
        for (var lease : issued) {
            var accountant = accounting.accountant(lease.pool());
            synchronized (accountant) {
                if (!lease.state().isLive() || !leases.remove(lease.jobId(), lease)) {
                    continue;
                }
                accountant.release(lease.priorityClass(), lease.resources());
                lease.setState(LeaseState.UNISSUED, ticker.read());
                jobs.requeue(lease.jobId());
                metrics.issueRolledBack(lease.pool().clusterId());
            }
        }
    }

    /**
     * Marks the pool's leases named by the executor as received.
     *
     * @return ids that were newly acknowledged
     */
    public List<String> acknowledge(PoolKey pool, Collection<String> receivedIds) {
        var acked = new ArrayList<Lease>();
        var accountant = accounting.accountant(pool);
        synchronized (accountant) {
            for (var id : new LinkedHashSet<>(receivedIds)) {
                var lease = leases.get(id);
                if (lease == null || !lease.pool().equals(pool) || !lease.state().isLive() || lease.acked()) {
                    continue;
                }
                lease.setAcked(true);
                acked.add(lease);
            }
            if (!acked.isEmpty()) {
                try {
                    store.saveLeases(acked.stream().map(l -> record(l, l.state())).toList());
                } catch (SQLException e) {
                    // the executor repeats received ids on its next message
                    LOG.warn("Cannot persist acks of {} leases in pool {}: {}", acked.size(), pool, e.getMessage());
                }
            }
        }
        return acked.stream().map(Lease::jobId).toList();
    }

    /**
     * Live leases of the pool, ordered by batch and then by job submission time.
     */
    public List<Lease> liveLeases(PoolKey pool) {
        var result = new ArrayList<Lease>();
        synchronized (accounting.accountant(pool)) {
            for (var lease : leases.values()) {
                if (lease.pool().equals(pool) && lease.state().isLive()) {
                    result.add(lease);
                }
            }
        }
        result.sort(LIVE_ORDER);
        return result;
    }

    /**
     * Live leases of the pool's most recent batch that was sent by another session.
     */
    public List<Lease> latestBatchOfOtherSession(PoolKey pool, String sessionId) {
        var live = liveLeases(pool);
        long latest = Long.MIN_VALUE;
        for (var lease : live) {
            if (!sessionId.equals(lease.sessionId())) {
                latest = Math.max(latest, lease.batchId());
            }
        }
        var result = new ArrayList<Lease>();
        for (var lease : live) {
            if (lease.batchId() == latest && !sessionId.equals(lease.sessionId())) {
                result.add(lease);
            }
        }
        return result;
    }

    /**
     * Live, unacknowledged leases of the pool that were never sent or were last sent at least
     * {@code resendAfterNanos} ago.
     */
    public List<Lease> resendCandidates(PoolKey pool, long resendAfterNanos) {
        long now = ticker.read();
        var result = new ArrayList<Lease>();
        for (var lease : liveLeases(pool)) {
            if (lease.acked()) {
                continue;
            }
            if (lease.lastSentNanos() == Lease.NEVER || now - lease.lastSentNanos() >= resendAfterNanos) {
                result.add(lease);
            }
        }
        return result;
    }

    /**
     * Makes the leases members of one batch sent by the session and snapshots which of them are acknowledged.
     */
    public LeaseBatch assignBatch(PoolKey pool, Collection<Lease> members, long batchId, String sessionId) {
        synchronized (accounting.accountant(pool)) {
            var unacked = new ArrayList<Lease>();
            for (var lease : members) {
                lease.assignBatch(batchId, sessionId);
                if (!lease.acked()) {
                    unacked.add(lease);
                }
            }
            return new LeaseBatch(batchId, List.copyOf(members), unacked);
        }
    }

    public void markSent(Lease lease) {
        synchronized (accounting.accountant(lease.pool())) {
            lease.markSent(ticker.read());
        }
    }

    /**
     * Extends the deadline of every live lease of the cluster among {@code ids}. A lease found past its
     * deadline expires instead.
     *
     * @return ids actually renewed, in request order
     */
    public List<String> renew(String clusterId, Collection<String> ids) {
        var renewed = new ArrayList<String>();
        for (var id : new LinkedHashSet<>(ids)) {
            var lease = leases.get(id);
            if (lease == null || !lease.pool().clusterId().equals(clusterId)) {
                continue;
            }
            var accountant = accounting.accountant(lease.pool());
            synchronized (accountant) {
                if (!lease.state().isLive()) {
                    continue;
                }
                long now = ticker.read();
                if (now - lease.deadlineNanos() >= 0) {
                    tryExpire(accountant, lease);
                    continue;
                }
                if (lease.state() == LeaseState.ISSUED) {
                    lease.setState(LeaseState.RENEWED, now);
                    journal.record(lease, LeaseState.RENEWED);
                }
                lease.setDeadlineNanos(now + leaseTtlNanos);
                metrics.transition(clusterId, LeaseState.RENEWED);
                renewed.add(id);
            }
        }
        return renewed;
    }

    /**
     * @return false if the job has no live lease on this cluster
     */
    public boolean returnLease(String clusterId, String jobId, Map<String, String> avoidNodeLabels, String reason)
        throws SQLException
    {
        var lease = leases.get(jobId);
        if (lease == null || !lease.pool().clusterId().equals(clusterId)) {
            return false;
        }
        var accountant = accounting.accountant(lease.pool());
        synchronized (accountant) {
            if (!lease.state().isLive()) {
                return false;
            }
            terminate(accountant, lease, LeaseState.RETURNED);
            jobs.avoidLabels(jobId, clusterId, avoidNodeLabels);
        }
        LOG.info("Lease {} returned by cluster {}: {}", jobId, clusterId, reason);
        return true;
    }

    /**
     * Completes the leases. Ids already done are included in the result again; unknown ids and leases that
     * ended otherwise are not.
     */
    public List<String> reportDone(Collection<String> ids) throws SQLException {
        var done = new ArrayList<String>();
        for (var id : new LinkedHashSet<>(ids)) {
            var lease = leases.get(id);
            if (lease == null) {
                continue;
            }
            var accountant = accounting.accountant(lease.pool());
            synchronized (accountant) {
                if (lease.state() == LeaseState.DONE) {
                    done.add(id);
                } else if (lease.state().isLive()) {
                    terminate(accountant, lease, LeaseState.DONE);
                    done.add(id);
                }
            }
        }
        if (!done.isEmpty()) {
            LOG.info("Leases done: {}", done);
        }
        return done;
    }

    /**
     * Expires overdue leases and forgets terminal ones older than the retention period, in memory and in
     * the store.
     *
     * @return number of leases expired
     */
    public int expireOverdue() {
        int expired = 0;
        var purged = new ArrayList<String>();
        long now = ticker.read();
        for (var lease : leases.values()) {
            var accountant = accounting.accountant(lease.pool());
            synchronized (accountant) {
                if (lease.state().isLive() && now - lease.deadlineNanos() >= 0) {
                    if (tryExpire(accountant, lease)) {
                        expired++;
                    }
                } else if (lease.state().isTerminal() && now - lease.terminatedNanos() >= retentionNanos) {
                    if (leases.remove(lease.jobId(), lease)) {
                        purged.add(lease.jobId());
                    }
                }
            }
        }
        if (!purged.isEmpty()) {
            try {
                store.deleteTerminalLeases(purged);
            } catch (SQLException e) {
                // terminal rows are never loaded back, so a leftover row is harmless
                LOG.warn("Cannot delete {} terminal leases: {}", purged.size(), e.getMessage());
            }
        }
        return expired;
    }

    /**
     * Loads jobs and live leases from the store. Restored leases get a fresh deadline and count as sent by
     * an earlier session.
     */
    public void restore() throws SQLException {
        var storedJobs = store.loadJobs();
        for (var job : storedJobs) {
            if (jobs.get(job.id()) == null) {
                jobs.submit(job);
            }
        }

        int restored = 0;
        for (var record : store.loadLiveLeases()) {
            var job = jobs.get(record.jobId());
            if (job == null) {
                LOG.warn("Skip restoring lease of unknown job {}", record.jobId());
                continue;
            }
            var pool = new PoolKey(record.clusterId(), record.pool());
            var accountant = accounting.accountant(pool);
            synchronized (accountant) {
                if (!jobs.tryLease(job.id())) {
                    LOG.warn("Skip restoring duplicate lease of job {}", job.id());
                    continue;
                }
                accountant.restore(record.priorityClass(), record.resources());
                var lease = new Lease(job, pool, record.priorityClass(), record.resources(), record.batchId(), null);
                long now = ticker.read();
                lease.setState(record.state(), now);
                lease.setAcked(record.acked());
                lease.setDeadlineNanos(now + leaseTtlNanos);
                leases.put(job.id(), lease);
                metrics.transition(pool.clusterId(), LeaseState.ISSUED);
            }
            batchIds.accumulateAndGet(record.batchId(), Math::max);
            restored++;
        }
        LOG.info("Restored {} jobs and {} live leases", storedJobs.size(), restored);
    }

    private boolean tryExpire(PriorityResourceAccountant accountant, Lease lease) {
        try {
            terminate(accountant, lease, LeaseState.EXPIRED);
            return true;
        } catch (SQLException e) {
            LOG.error("Cannot expire lease {}, will retry: {}", lease.jobId(), e.getMessage(), e);
            return false;
        }
    }

    private void terminate(PriorityResourceAccountant accountant, Lease lease, LeaseState state)
        throws SQLException
    {
        store.saveLeases(List.of(record(lease, state)));
        if (state == LeaseState.DONE) {
            store.archiveJobs(List.of(lease.jobId()));
        }

        accountant.release(lease.priorityClass(), lease.resources());
        lease.setState(state, ticker.read());
        if (state == LeaseState.DONE) {
            jobs.archive(lease.jobId());
        } else {
            jobs.requeue(lease.jobId());
        }

        metrics.transition(lease.pool().clusterId(), state);
        journal.record(lease, state);
        if (state == LeaseState.EXPIRED) {
            LOG.info("Lease {} on {} expired", lease.jobId(), lease.pool());
        }
    }

    private LeaseRecord record(Lease lease, LeaseState state) {
        var pool = lease.pool();
        return new LeaseRecord(lease.jobId(), pool.clusterId(), pool.pool(), lease.priorityClass(),
            lease.resources(), state, lease.acked(), lease.batchId(), clock.instant());
    }
}
