package ai.convoy.scheduler.lease;

import ai.convoy.scheduler.accounting.PoolKey;
import ai.convoy.scheduler.lifecycle.Lease;
import ai.convoy.scheduler.lifecycle.LeaseBatch;
import ai.convoy.scheduler.lifecycle.LeaseLifecycleManager;
import ai.convoy.scheduler.metrics.LeaseMetrics;
import ai.convoy.v1.QueueApi.StreamingJobLease;
import ai.convoy.v1.QueueApi.StreamingLeaseRequest;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.UUID;

/**
 * Protocol handler of one {@code StreamingLeaseJobs} call.
 *
 * <p>The first message must name the cluster. Every message then updates the executor view, acknowledges
 * the job ids it lists and triggers one batch: on the first batch of the session the last batch another
 * session left behind, then leases still unacknowledged after {@code resendAfter}, then newly admitted jobs.
 * Only unacknowledged members are sent.
 *
 * <p>Closing the stream, from either side, never releases leases.
 */
public class LeaseSession implements StreamObserver<StreamingLeaseRequest> {
    private static final Logger LOG = LogManager.getLogger(LeaseSession.class);

    private final String id = UUID.randomUUID().toString();
    private final StreamObserver<StreamingJobLease> responses;
    private final JobLeaser leaser;
    private final LeaseLifecycleManager lifecycle;
    private final SessionRegistry registry;
    private final LeaseMetrics metrics;
    private final long resendAfterNanos;
    private final int maxJobsPerBatch;

    private final ExecutorView view = new ExecutorView();
    private SessionState state = SessionState.HANDSHAKE;
    private PoolKey pool;
    private boolean firstBatch = true;

    public LeaseSession(StreamObserver<StreamingJobLease> responses, JobLeaser leaser,
                        LeaseLifecycleManager lifecycle, SessionRegistry registry, LeaseMetrics metrics,
                        Duration resendAfter, int maxJobsPerBatch)
    {
        this.responses = responses;
        this.leaser = leaser;
        this.lifecycle = lifecycle;
        this.registry = registry;
        this.metrics = metrics;
        this.resendAfterNanos = resendAfter.toNanos();
        this.maxJobsPerBatch = maxJobsPerBatch;
    }

    public String id() {
        return id;
    }

    public synchronized SessionState state() {
        return state;
    }

    @Override
    public synchronized void onNext(StreamingLeaseRequest request) {
        if (state == SessionState.DRAINING || state == SessionState.CLOSED) {
            LOG.debug("Session {} ignores a message in state {}", id, state);
            return;
        }
        try {
            handle(request);
        } catch (StatusException e) {
            fail(e.getStatus());
        } catch (IllegalArgumentException e) {
            fail(Status.INVALID_ARGUMENT.withDescription(e.getMessage()));
        } catch (StatusRuntimeException e) {
            // raised by onNext of a cancelled call
            LOG.info("Session {} for {} lost its stream: {}", id, pool, e.getStatus());
            close();
        } catch (RuntimeException e) {
            LOG.error("Session {} for {} failed: {}", id, pool, e.getMessage(), e);
            fail(Status.INTERNAL.withDescription(e.getMessage()));
        }
    }

    @Override
    public synchronized void onError(Throwable t) {
        LOG.info("Session {} for {} closed by executor: {}", id, pool, Status.fromThrowable(t));
        close();
    }

    @Override
    public synchronized void onCompleted() {
        LOG.info("Session {} for {} completed by executor", id, pool);
        if (close()) {
            responses.onCompleted();
        }
    }

    /**
     * Server-side shutdown of the stream.
     */
    public synchronized void drain() {
        if (close()) {
            responses.onCompleted();
        }
    }

    private void handle(StreamingLeaseRequest request) throws StatusException {
        view.merge(request);

        if (state == SessionState.HANDSHAKE) {
            if (view.clusterId().isEmpty()) {
                metrics.sessionRejected("handshake");
                throw Status.INVALID_ARGUMENT.withDescription("First message must carry cluster_id").asException();
            }
            var candidate = view.poolKey();
            if (!registry.register(candidate, this)) {
                metrics.sessionRejected("conflict");
                throw Status.ALREADY_EXISTS
                    .withDescription("A lease session for " + candidate + " is already open")
                    .asException();
            }
            pool = candidate;
            metrics.sessionOpened();
            LOG.info("Session {} opened for {}", id, pool);
        }

        state = SessionState.STREAMING;
        leaser.applyReport(view);
        var acked = lifecycle.acknowledge(pool, request.getReceivedJobIdsList());
        if (!acked.isEmpty()) {
            LOG.debug("Session {} got acks for {}", id, acked);
        }

        sendBatch();
        state = SessionState.AWAITING_ACKS;
    }

    private void sendBatch() throws StatusException {
        var members = new LinkedHashMap<String, Lease>();
        if (firstBatch) {
            lifecycle.latestBatchOfOtherSession(pool, id).forEach(l -> members.putIfAbsent(l.jobId(), l));
            firstBatch = false;
        }
        lifecycle.resendCandidates(pool, resendAfterNanos).forEach(l -> members.putIfAbsent(l.jobId(), l));
        var carried = members.size();

        long batchId = lifecycle.nextBatchId();
        for (var lease : leaser.leaseNewJobs(view, batchId, id, maxJobsPerBatch)) {
            members.putIfAbsent(lease.jobId(), lease);
        }
        if (members.isEmpty()) {
            return;
        }

        LeaseBatch batch = lifecycle.assignBatch(pool, members.values(), batchId, id);
        int resent = 0;
        int index = 0;
        for (var lease : batch.unacked()) {
            responses.onNext(StreamingJobLease.newBuilder()
                .setJob(lease.job().toProto())
                .setNumJobs(batch.numJobs())
                .setNumAcked(batch.numAcked())
                .build());
            lifecycle.markSent(lease);
            if (index++ < carried) {
                resent++;
            }
        }
        metrics.batchSent(pool.clusterId(), resent);
        LOG.debug("Session {} sent batch {} to {}: {} jobs, {} acked, {} resent", id, batchId, pool,
            batch.numJobs(), batch.numAcked(), resent);
    }

    private void fail(Status status) {
        LOG.warn("Session {} for {} failed: {}", id, pool, status);
        if (close()) {
            responses.onError(status.asException());
        }
    }

    /**
     * @return false if the session was closed already
     */
    private boolean close() {
        if (state == SessionState.CLOSED) {
            return false;
        }
        state = SessionState.DRAINING;
        if (pool != null) {
            registry.unregister(pool, this);
            metrics.sessionClosed();
            LOG.info("Session {} for {} closed, {} leases stay live", id, pool, lifecycle.liveLeases(pool).size());
        }
        state = SessionState.CLOSED;
        return true;
    }
}
