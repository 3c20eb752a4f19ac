package ai.convoy.scheduler.services;

import ai.convoy.scheduler.configs.ServiceConfig;
import ai.convoy.scheduler.lease.ExecutorView;
import ai.convoy.scheduler.lease.JobLeaser;
import ai.convoy.scheduler.lease.LeaseSession;
import ai.convoy.scheduler.lease.SessionRegistry;
import ai.convoy.scheduler.lifecycle.Lease;
import ai.convoy.scheduler.lifecycle.LeaseLifecycleManager;
import ai.convoy.scheduler.metrics.LeaseMetrics;
import ai.convoy.v1.AggregatedQueueGrpc;
import ai.convoy.v1.QueueApi.IdList;
import ai.convoy.v1.QueueApi.JobLease;
import ai.convoy.v1.QueueApi.LeaseRequest;
import ai.convoy.v1.QueueApi.RenewLeaseRequest;
import ai.convoy.v1.QueueApi.ReturnLeaseRequest;
import ai.convoy.v1.QueueApi.StreamingJobLease;
import ai.convoy.v1.QueueApi.StreamingLeaseRequest;
import com.google.protobuf.Empty;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.stub.StreamObserver;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.UUID;

@Singleton
public class AggregatedQueueService extends AggregatedQueueGrpc.AggregatedQueueImplBase {
    private static final Logger LOG = LogManager.getLogger(AggregatedQueueService.class);

    private final JobLeaser leaser;
    private final LeaseLifecycleManager lifecycle;
    private final SessionRegistry sessions;
    private final LeaseMetrics metrics;
    private final ServiceConfig config;

    public AggregatedQueueService(JobLeaser leaser, LeaseLifecycleManager lifecycle, SessionRegistry sessions,
                                  LeaseMetrics metrics, ServiceConfig config)
    {
        this.leaser = leaser;
        this.lifecycle = lifecycle;
        this.sessions = sessions;
        this.metrics = metrics;
        this.config = config;
    }

    /**
     * One-shot lease call. The response is the delivery, so the leases count as acknowledged.
     */
    @Override
    public void leaseJobs(LeaseRequest request, StreamObserver<JobLease> responseObserver) {
        if (request.getClusterId().isEmpty()) {
            responseObserver.onError(Status.INVALID_ARGUMENT.withDescription("cluster_id is required").asException());
            return;
        }

        final ExecutorView view;
        try {
            view = ExecutorView.of(request);
        } catch (IllegalArgumentException e) {
            responseObserver.onError(Status.INVALID_ARGUMENT.withDescription(e.getMessage()).asException());
            return;
        }

        var pool = view.poolKey();
        var callId = UUID.randomUUID().toString();
        if (!sessions.registerCall(pool, callId)) {
            metrics.sessionRejected("conflict");
            responseObserver.onError(Status.ALREADY_EXISTS
                .withDescription("A lease session for " + pool + " is already open").asException());
            return;
        }

        try {
            leaser.applyReport(view);
            var leased = leaser.leaseNewJobs(view, lifecycle.nextBatchId(), "", config.getMaxJobsPerBatch());
            lifecycle.acknowledge(pool, leased.stream().map(Lease::jobId).toList());

            var response = JobLease.newBuilder();
            leased.forEach(lease -> response.addJob(lease.job().toProto()));
            LOG.info("Leased {} jobs to {}", leased.size(), pool);
            responseObserver.onNext(response.build());
            responseObserver.onCompleted();
        } catch (StatusException e) {
            responseObserver.onError(e);
        } finally {
            sessions.unregisterCall(pool, callId);
        }
    }

    @Override
    public StreamObserver<StreamingLeaseRequest> streamingLeaseJobs(
        StreamObserver<StreamingJobLease> responseObserver)
    {
        return new LeaseSession(responseObserver, leaser, lifecycle, sessions, metrics, config.getResendAfter(),
            config.getMaxJobsPerBatch());
    }

    @Override
    public void renewLease(RenewLeaseRequest request, StreamObserver<IdList> responseObserver) {
        if (request.getClusterId().isEmpty()) {
            responseObserver.onError(Status.INVALID_ARGUMENT.withDescription("cluster_id is required").asException());
            return;
        }

        var renewed = lifecycle.renew(request.getClusterId(), request.getIdsList());
        if (renewed.size() < request.getIdsCount()) {
            LOG.debug("Cluster {} renewed {} of {} leases", request.getClusterId(), renewed.size(),
                request.getIdsCount());
        }
        responseObserver.onNext(IdList.newBuilder().addAllIds(renewed).build());
        responseObserver.onCompleted();
    }

    @Override
    public void returnLease(ReturnLeaseRequest request, StreamObserver<Empty> responseObserver) {
        if (request.getClusterId().isEmpty() || request.getJobId().isEmpty()) {
            responseObserver.onError(Status.INVALID_ARGUMENT
                .withDescription("cluster_id and job_id are required").asException());
            return;
        }

        var avoid = new LinkedHashMap<String, String>();
        request.getAvoidNodeLabels().getEntriesList().forEach(e -> avoid.put(e.getKey(), e.getValue()));

        try {
            if (!lifecycle.returnLease(request.getClusterId(), request.getJobId(), avoid, request.getReason())) {
                LOG.warn("Cluster {} returned job {} without holding a live lease on it",
                    request.getClusterId(), request.getJobId());
            }
        } catch (SQLException e) {
            LOG.error("Cannot return lease {}: {}", request.getJobId(), e.getMessage(), e);
            responseObserver.onError(Status.UNAVAILABLE.withDescription("Cannot persist returned lease")
                .asException());
            return;
        }
        responseObserver.onNext(Empty.getDefaultInstance());
        responseObserver.onCompleted();
    }

    @Override
    public void reportDone(IdList request, StreamObserver<IdList> responseObserver) {
        try {
            var done = lifecycle.reportDone(request.getIdsList());
            responseObserver.onNext(IdList.newBuilder().addAllIds(done).build());
            responseObserver.onCompleted();
        } catch (SQLException e) {
            LOG.error("Cannot complete leases {}: {}", request.getIdsList(), e.getMessage(), e);
            responseObserver.onError(Status.UNAVAILABLE.withDescription("Cannot persist completed leases")
                .asException());
        }
    }
}
