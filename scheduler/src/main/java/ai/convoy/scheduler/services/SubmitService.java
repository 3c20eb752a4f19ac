package ai.convoy.scheduler.services;

import ai.convoy.scheduler.db.LeaseStore;
import ai.convoy.scheduler.jobs.Job;
import ai.convoy.scheduler.jobs.JobRepository;
import ai.convoy.scheduler.jobs.PriorityClasses;
import ai.convoy.scheduler.metrics.LeaseMetrics;
import ai.convoy.scheduler.nodes.Toleration;
import ai.convoy.scheduler.resources.ComputeResources;
import ai.convoy.util.auth.grpc.AuthenticationContext;
import ai.convoy.v1.SubmitApi.JobSubmitRequest;
import ai.convoy.v1.SubmitApi.JobSubmitRequestItem;
import ai.convoy.v1.SubmitApi.JobSubmitResponse;
import ai.convoy.v1.SubmitApi.JobSubmitResponseItem;
import ai.convoy.v1.SubmitGrpc;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Map;
import java.util.UUID;

/**
 * Appends jobs to queue backlogs. Items are validated one by one; a rejected item carries an error in the
 * response and does not prevent the others from being accepted.
 */
@Singleton
public class SubmitService extends SubmitGrpc.SubmitImplBase {
    private static final Logger LOG = LogManager.getLogger(SubmitService.class);

    private final JobRepository jobs;
    private final LeaseStore store;
    private final PriorityClasses priorityClasses;
    private final LeaseMetrics metrics;
    private final Clock clock;

    public SubmitService(JobRepository jobs, LeaseStore store, PriorityClasses priorityClasses,
                         LeaseMetrics metrics, Clock clock)
    {
        this.jobs = jobs;
        this.store = store;
        this.priorityClasses = priorityClasses;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public void submitJobs(JobSubmitRequest request, StreamObserver<JobSubmitResponse> responseObserver) {
        if (request.getQueue().isEmpty() || request.getJobSetId().isEmpty()) {
            responseObserver.onError(Status.INVALID_ARGUMENT
                .withDescription("queue and job_set_id are required").asException());
            return;
        }
        if (request.getJobRequestItemsCount() == 0) {
            responseObserver.onError(Status.INVALID_ARGUMENT
                .withDescription("At least one job request item is required").asException());
            return;
        }

        var auth = AuthenticationContext.current();
        var owner = auth == null ? "" : auth.principal().name();
        var now = clock.instant();

        var accepted = new ArrayList<Job>();
        var response = JobSubmitResponse.newBuilder();
        for (var item : request.getJobRequestItemsList()) {
            var id = UUID.randomUUID().toString();
            try {
                var resources = parseRequests(item.getResourceRequestsMap());
                if (!priorityClasses.isKnown(item.getPriorityClassName())) {
                    throw new IllegalArgumentException("Unknown priority class " + item.getPriorityClassName());
                }
                accepted.add(toJob(id, request, item, owner, resources, now));
                response.addJobResponseItems(JobSubmitResponseItem.newBuilder().setJobId(id));
            } catch (IllegalArgumentException e) {
                response.addJobResponseItems(JobSubmitResponseItem.newBuilder().setError(e.getMessage()));
            }
        }

        if (!accepted.isEmpty()) {
            try {
                store.saveJobs(accepted);
            } catch (SQLException e) {
                LOG.error("Cannot persist {} jobs of queue {}: {}", accepted.size(), request.getQueue(),
                    e.getMessage(), e);
                responseObserver.onError(Status.UNAVAILABLE.withDescription("Cannot persist jobs").asException());
                return;
            }
            accepted.forEach(jobs::submit);
            metrics.jobsSubmitted(request.getQueue(), accepted.size());
        }

        LOG.info("Accepted {} of {} jobs into queue {}, job set {}", accepted.size(),
            request.getJobRequestItemsCount(), request.getQueue(), request.getJobSetId());
        responseObserver.onNext(response.build());
        responseObserver.onCompleted();
    }

    private static ComputeResources parseRequests(Map<String, String> requests) {
        var resources = ComputeResources.parse(requests);
        if (resources.isEmpty()) {
            throw new IllegalArgumentException("Job must request a positive amount of some resource");
        }
        return resources;
    }

    private static Job toJob(String id, JobSubmitRequest request, JobSubmitRequestItem item, String owner,
                             ComputeResources resources, Instant created)
    {
        return new Job(
            id,
            item.getClientId(),
            request.getQueue(),
            request.getJobSetId(),
            item.getNamespace(),
            owner,
            item.getPriority(),
            created,
            "",
            Map.copyOf(item.getLabelsMap()),
            Map.copyOf(item.getAnnotationsMap()),
            Map.copyOf(item.getRequiredNodeLabelsMap()),
            resources,
            item.getTolerationsList().stream().map(Toleration::fromProto).toList(),
            item.getPriorityClassName());
    }
}
