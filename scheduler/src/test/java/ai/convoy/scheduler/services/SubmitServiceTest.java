package ai.convoy.scheduler.services;

import ai.convoy.scheduler.FlakyLeaseStore;
import ai.convoy.scheduler.SchedulerHarness;
import ai.convoy.util.auth.Principal;
import ai.convoy.util.auth.grpc.AuthenticationContext;
import ai.convoy.v1.QueueApi.Toleration;
import ai.convoy.v1.SubmitApi.JobSubmitRequest;
import ai.convoy.v1.SubmitApi.JobSubmitRequestItem;
import ai.convoy.v1.SubmitApi.JobSubmitResponse;
import io.grpc.Context;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import static ai.convoy.scheduler.SchedulerHarness.cpu;

public class SubmitServiceTest {
    private FlakyLeaseStore store;
    private SchedulerHarness h;
    private SubmitService service;

    @Before
    public void setUp() {
        store = new FlakyLeaseStore();
        h = new SchedulerHarness(store);
        service = new SubmitService(h.jobs, store, h.priorityClasses, h.metrics, h.clock);
    }

    @After
    public void tearDown() {
        h.close();
    }

    private static final class Result implements StreamObserver<JobSubmitResponse> {
        JobSubmitResponse response;
        Status error;

        @Override
        public void onNext(JobSubmitResponse value) {
            response = value;
        }

        @Override
        public void onError(Throwable t) {
            error = Status.fromThrowable(t);
        }

        @Override
        public void onCompleted() {
        }
    }

    private Result submit(JobSubmitRequest request) {
        var result = new Result();
        service.submitJobs(request, result);
        return result;
    }

    private static JobSubmitRequestItem.Builder item(String cpu) {
        return JobSubmitRequestItem.newBuilder().setNamespace("default").putResourceRequests("cpu", cpu);
    }

    @Test
    public void testAcceptsValidItems() throws Exception {
        var result = submit(JobSubmitRequest.newBuilder()
            .setQueue("q1")
            .setJobSetId("set-1")
            .addJobRequestItems(item("2").setClientId("c-1").setPriority(3).setPriorityClassName("high")
                .putRequiredNodeLabels("zone", "a")
                .addTolerations(Toleration.newBuilder().setKey("gpu").setOperator("Exists")))
            .addJobRequestItems(item("500m"))
            .build());

        Assert.assertNull(result.error);
        var items = result.response.getJobResponseItemsList();
        Assert.assertEquals(2, items.size());
        items.forEach(i -> Assert.assertEquals("", i.getError()));

        var job = h.jobs.get(items.get(0).getJobId());
        Assert.assertEquals("q1", job.queue());
        Assert.assertEquals("set-1", job.jobSetId());
        Assert.assertEquals("c-1", job.clientId());
        Assert.assertEquals(cpu("2"), job.resourceRequests());
        Assert.assertEquals("zone", job.requiredNodeLabels().keySet().iterator().next());
        Assert.assertEquals(1, job.tolerations().size());
        Assert.assertEquals("", job.owner());

        Assert.assertEquals(2, h.jobs.backlog("q1").size());
        Assert.assertEquals(2, store.loadJobs().size());
        Assert.assertEquals(2.0, h.registry.getSampleValue("scheduler_submitted_jobs_total",
            new String[] {"queue"}, new String[] {"q1"}), 0.0);
    }

    @Test
    public void testRejectsBadItemsIndividually() {
        var result = submit(JobSubmitRequest.newBuilder()
            .setQueue("q1")
            .setJobSetId("set-1")
            .addJobRequestItems(item("lots"))
            .addJobRequestItems(JobSubmitRequestItem.newBuilder())
            .addJobRequestItems(item("1").setPriorityClassName("platinum"))
            .addJobRequestItems(item("1"))
            .build());

        Assert.assertNull(result.error);
        var items = result.response.getJobResponseItemsList();
        Assert.assertEquals(4, items.size());
        for (int i = 0; i < 3; i++) {
            Assert.assertEquals("", items.get(i).getJobId());
            Assert.assertFalse(items.get(i).getError().isEmpty());
        }
        Assert.assertEquals("", items.get(3).getError());
        Assert.assertEquals(1, h.jobs.size());
    }

    @Test
    public void testRejectsMalformedRequests() {
        Assert.assertEquals(Status.Code.INVALID_ARGUMENT, submit(JobSubmitRequest.newBuilder()
            .setJobSetId("set-1").addJobRequestItems(item("1")).build()).error.getCode());
        Assert.assertEquals(Status.Code.INVALID_ARGUMENT, submit(JobSubmitRequest.newBuilder()
            .setQueue("q1").setJobSetId("set-1").build()).error.getCode());
    }

    @Test
    public void testOwnerFromAuthenticatedCaller() throws Exception {
        var request = JobSubmitRequest.newBuilder()
            .setQueue("q1")
            .setJobSetId("set-1")
            .addJobRequestItems(item("1"))
            .build();

        var caller = new AuthenticationContext(Principal.of("system:serviceaccount:ns:ci"));
        var result = Context.current().withValue(AuthenticationContext.KEY, caller).call(() -> submit(request));

        var id = result.response.getJobResponseItems(0).getJobId();
        Assert.assertEquals("system:serviceaccount:ns:ci", h.jobs.get(id).owner());
    }

    @Test
    public void testStoreFailureAcceptsNothing() {
        store.setFailing(true);
        var result = submit(JobSubmitRequest.newBuilder()
            .setQueue("q1")
            .setJobSetId("set-1")
            .addJobRequestItems(item("1"))
            .build());

        Assert.assertEquals(Status.Code.UNAVAILABLE, result.error.getCode());
        Assert.assertEquals(0, h.jobs.size());
    }
}
