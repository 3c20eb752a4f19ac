package ai.convoy.scheduler.lease;

import ai.convoy.scheduler.accounting.PriorityResourceAccountant;
import ai.convoy.scheduler.accounting.ResourceAccounting;
import ai.convoy.scheduler.configs.ServiceConfig;
import ai.convoy.scheduler.jobs.Job;
import ai.convoy.scheduler.jobs.JobRepository;
import ai.convoy.scheduler.jobs.PriorityClasses;
import ai.convoy.scheduler.lifecycle.Lease;
import ai.convoy.scheduler.lifecycle.LeaseLifecycleManager;
import ai.convoy.scheduler.nodes.NodeType;
import ai.convoy.scheduler.nodes.NodeTypeClassifier;
import ai.convoy.scheduler.nodes.NodeTypeGroup;
import ai.convoy.scheduler.oracle.FairnessOracle;
import ai.convoy.scheduler.oracle.SchedulingContext;
import ai.convoy.scheduler.resources.ComputeResources;
import ai.convoy.scheduler.usage.QueueUsageAggregator;
import io.grpc.Status;
import io.grpc.StatusException;
import jakarta.annotation.Nullable;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns an executor's capacity report into new leases: asks the fairness oracle for candidates, then admits
 * each one that fits a node type and the priority headroom of the pool.
 */
@Singleton
public class JobLeaser {
    private static final Logger LOG = LogManager.getLogger(JobLeaser.class);

    private final ResourceAccounting accounting;
    private final LeaseLifecycleManager lifecycle;
    private final FairnessOracle oracle;
    private final QueueUsageAggregator usage;
    private final JobRepository jobs;
    private final PriorityClasses priorityClasses;
    private final NodeTypeClassifier classifier;
    private final ExecutorService oracleExecutor;
    private final Duration oracleTimeout;

    @Inject
    public JobLeaser(ResourceAccounting accounting, LeaseLifecycleManager lifecycle, FairnessOracle oracle,
                     QueueUsageAggregator usage, JobRepository jobs, PriorityClasses priorityClasses,
                     NodeTypeClassifier classifier, @Named("OracleExecutor") ExecutorService oracleExecutor,
                     ServiceConfig config)
    {
        this(accounting, lifecycle, oracle, usage, jobs, priorityClasses, classifier, oracleExecutor,
            config.getOracleTimeout());
    }

    public JobLeaser(ResourceAccounting accounting, LeaseLifecycleManager lifecycle, FairnessOracle oracle,
                     QueueUsageAggregator usage, JobRepository jobs, PriorityClasses priorityClasses,
                     NodeTypeClassifier classifier, ExecutorService oracleExecutor, Duration oracleTimeout)
    {
        this.accounting = accounting;
        this.lifecycle = lifecycle;
        this.oracle = oracle;
        this.usage = usage;
        this.jobs = jobs;
        this.priorityClasses = priorityClasses;
        this.classifier = classifier;
        this.oracleExecutor = oracleExecutor;
        this.oracleTimeout = oracleTimeout;
    }

    /**
     * Takes the pool capacity and the queue usage report of the executor into account.
     */
    public void applyReport(ExecutorView view) {
        accounting.accountant(view.poolKey()).updateCapacity(view.capacity());
        var report = view.usageReport();
        if (report != null) {
            usage.update(report);
        }
    }

    /**
     * Selects and admits up to {@code maxJobs} queued jobs for the pool, commits their resources and persists
     * the leases. Nothing stays committed if this throws.
     *
     * @throws StatusException {@code UNAVAILABLE} if the oracle or the store fails, {@code DEADLINE_EXCEEDED}
     *                         if the oracle does not answer in time
     */
    public List<Lease> leaseNewJobs(ExecutorView view, long batchId, String sessionId, int maxJobs)
        throws StatusException
    {
        var pool = view.poolKey();
        var accountant = accounting.accountant(pool);
        var groups = view.nodes().isEmpty() ? null : new ArrayList<>(classifier.classify(view.nodes()).values());

        var context = new SchedulingContext(pool, accountant.capacity(), headroom(accountant),
            groups == null ? List.of() : groups, view.minimumJobSize(), maxJobs);
        var candidates = select(context);

        var issued = new ArrayList<Lease>();
        var placed = new HashMap<NodeType, ComputeResources>();
        synchronized (accountant) {
            for (var job : candidates) {
                if (issued.size() >= maxJobs) {
                    break;
                }
                var lease = tryAdmit(accountant, view, groups, placed, job, batchId, sessionId);
                if (lease != null) {
                    issued.add(lease);
                }
            }
        }
        if (issued.size() < candidates.size()) {
            LOG.debug("Admitted {} of {} candidates for {}", issued.size(), candidates.size(), pool);
        }

        try {
            lifecycle.persistIssued(issued);
        } catch (SQLException e) {
            throw Status.UNAVAILABLE.withDescription("Cannot persist leases: " + e.getMessage()).withCause(e)
                .asException();
        }
        return issued;
    }

    @Nullable
    private Lease tryAdmit(PriorityResourceAccountant accountant, ExecutorView view,
                           @Nullable List<NodeTypeGroup> groups, Map<NodeType, ComputeResources> placed, Job job,
                           long batchId, String sessionId)
    {
        int priority;
        try {
            priority = priorityClasses.resolve(job.priorityClassName());
        } catch (IllegalArgumentException e) {
            LOG.warn("Skip job {}: {}", job.id(), e.getMessage());
            return null;
        }

        var request = job.resourceRequests();
        if (!request.meetsMinimum(view.minimumJobSize())) {
            return null;
        }

        NodeType target = null;
        if (groups != null) {
            target = findNodeType(job, priority, groups, placed, view.clusterId());
            if (target == null) {
                return null;
            }
        }
        if (!accountant.canAdmit(priority, request)) {
            return null;
        }

        var lease = lifecycle.issue(accountant, job, priority, batchId, sessionId);
        if (lease != null && target != null) {
            placed.merge(target, request, ComputeResources::add);
        }
        return lease;
    }

    /**
     * First node type that can run the job, trying types carrying labels the job was asked to avoid last.
     */
    @Nullable
    private NodeType findNodeType(Job job, int priority, List<NodeTypeGroup> groups,
                                  Map<NodeType, ComputeResources> placed, String clusterId)
    {
        var avoided = jobs.avoidedLabels(job.id(), clusterId);
        NodeType fallback = null;
        for (var group : groups) {
            if (!fits(job, priority, group, placed)) {
                continue;
            }
            if (avoided.isEmpty() || !group.nodeType().matchesAny(avoided)) {
                return group.nodeType();
            }
            if (fallback == null) {
                fallback = group.nodeType();
            }
        }
        return fallback;
    }

    private static boolean fits(Job job, int priority, NodeTypeGroup group, Map<NodeType, ComputeResources> placed) {
        var type = group.nodeType();
        var request = job.resourceRequests();
        if (!type.tolerates(job.tolerations()) || !type.hasLabels(job.requiredNodeLabels())) {
            return false;
        }
        if (!request.fitsWithin(type.allocatable())) {
            return false;
        }
        var free = group.availableAt(priority).subtractClamped(placed.getOrDefault(type, ComputeResources.EMPTY));
        return request.fitsWithin(free);
    }

    private TreeMap<Integer, ComputeResources> headroom(PriorityResourceAccountant accountant) {
        var result = new TreeMap<Integer, ComputeResources>();
        for (int priority : priorityClasses.values()) {
            result.put(priority, accountant.headroom(priority));
        }
        return result;
    }

    private List<Job> select(SchedulingContext context) throws StatusException {
        var future = oracleExecutor.submit(() -> oracle.selectJobs(context));
        try {
            return future.get(oracleTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.error("Fairness oracle did not answer within {} for {}", oracleTimeout, context.pool());
            throw Status.DEADLINE_EXCEEDED.withDescription("Fairness oracle timed out").asException();
        } catch (ExecutionException e) {
            LOG.error("Fairness oracle failed for {}: {}", context.pool(), e.getCause().getMessage(), e.getCause());
            throw Status.UNAVAILABLE.withDescription("Fairness oracle failed: " + e.getCause().getMessage())
                .withCause(e.getCause()).asException();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw Status.CANCELLED.withDescription("Interrupted while selecting jobs").asException();
        }
    }
}
