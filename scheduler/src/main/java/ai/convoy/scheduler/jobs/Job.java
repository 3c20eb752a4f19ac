package ai.convoy.scheduler.jobs;

import ai.convoy.scheduler.nodes.Toleration;
import ai.convoy.scheduler.resources.ComputeResources;
import ai.convoy.v1.QueueApi;
import com.google.protobuf.Timestamp;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable unit of work. {@code priority} is opaque here; only the fairness oracle orders by it.
 */
public record Job(
    String id,
    String clientId,
    String queue,
    String jobSetId,
    String namespace,
    String owner,
    double priority,
    Instant created,
    String scheduler,
    Map<String, String> labels,
    Map<String, String> annotations,
    Map<String, String> requiredNodeLabels,
    ComputeResources resourceRequests,
    List<Toleration> tolerations,
    String priorityClassName
) {
    /**
     * @throws IllegalArgumentException if a resource quantity cannot be parsed
     */
    public static Job fromProto(QueueApi.Job job) {
        var created = job.getCreated();
        return new Job(
            job.getId(),
            job.getClientId(),
            job.getQueue(),
            job.getJobSetId(),
            job.getNamespace(),
            job.getOwner(),
            job.getPriority(),
            Instant.ofEpochSecond(created.getSeconds(), created.getNanos()),
            job.getScheduler(),
            Map.copyOf(job.getLabelsMap()),
            Map.copyOf(job.getAnnotationsMap()),
            Map.copyOf(job.getRequiredNodeLabelsMap()),
            ComputeResources.parse(job.getResourceRequestsMap()),
            job.getTolerationsList().stream().map(Toleration::fromProto).toList(),
            job.getPriorityClassName());
    }

    public QueueApi.Job toProto() {
        return QueueApi.Job.newBuilder()
            .setId(id)
            .setClientId(clientId)
            .setQueue(queue)
            .setJobSetId(jobSetId)
            .setNamespace(namespace)
            .setOwner(owner)
            .setPriority(priority)
            .setCreated(Timestamp.newBuilder()
                .setSeconds(created.getEpochSecond())
                .setNanos(created.getNano())
                .build())
            .setScheduler(scheduler)
            .putAllLabels(labels)
            .putAllAnnotations(annotations)
            .putAllRequiredNodeLabels(requiredNodeLabels)
            .putAllResourceRequests(resourceRequests.toQuantities())
            .addAllTolerations(tolerations.stream().map(Toleration::toProto).toList())
            .setPriorityClassName(priorityClassName)
            .build();
    }
}
