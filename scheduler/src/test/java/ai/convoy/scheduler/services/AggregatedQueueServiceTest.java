package ai.convoy.scheduler.services;

import ai.convoy.scheduler.FlakyLeaseStore;
import ai.convoy.scheduler.SchedulerHarness;
import ai.convoy.scheduler.configs.ServiceConfig;
import ai.convoy.scheduler.lifecycle.LeaseState;
import ai.convoy.v1.AggregatedQueueGrpc;
import ai.convoy.v1.QueueApi.IdList;
import ai.convoy.v1.QueueApi.JobLease;
import ai.convoy.v1.QueueApi.LeaseRequest;
import ai.convoy.v1.QueueApi.OrderedStringMap;
import ai.convoy.v1.QueueApi.RenewLeaseRequest;
import ai.convoy.v1.QueueApi.ReturnLeaseRequest;
import ai.convoy.v1.QueueApi.StreamingJobLease;
import ai.convoy.v1.QueueApi.StreamingLeaseRequest;
import ai.convoy.v1.QueueApi.StringKeyValuePair;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.StreamObserver;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static ai.convoy.scheduler.SchedulerHarness.CLUSTER;
import static ai.convoy.scheduler.SchedulerHarness.POOL;

public class AggregatedQueueServiceTest {
    private FlakyLeaseStore store;
    private SchedulerHarness h;
    private Server server;
    private ManagedChannel channel;
    private AggregatedQueueGrpc.AggregatedQueueBlockingStub queue;

    @Before
    public void setUp() throws Exception {
        store = new FlakyLeaseStore();
        h = new SchedulerHarness(store);

        var config = new ServiceConfig();
        config.setResendAfter(Duration.ofMinutes(1));
        config.setMaxJobsPerBatch(10);

        var name = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder.forName(name)
            .directExecutor()
            .addService(new AggregatedQueueService(h.leaser, h.lifecycle, h.sessions, h.metrics, config))
            .build()
            .start();
        channel = InProcessChannelBuilder.forName(name).directExecutor().build();
        queue = AggregatedQueueGrpc.newBlockingStub(channel);
    }

    @After
    public void tearDown() throws InterruptedException {
        channel.shutdownNow();
        server.shutdownNow();
        server.awaitTermination();
        h.close();
    }

    private static LeaseRequest leaseRequest(String clusterId) {
        return LeaseRequest.newBuilder()
            .setClusterId(clusterId)
            .setPool("default")
            .putResources("cpu", "10")
            .build();
    }

    private static Status.Code codeOf(Runnable call) {
        try {
            call.run();
        } catch (StatusRuntimeException e) {
            return e.getStatus().getCode();
        }
        throw new AssertionError("call did not fail");
    }

    @Test
    public void testLeaseRenewReturnDone() throws Exception {
        h.submit("j1", "q1", "4");
        h.submit("j2", "q2", "4");
        h.submit("j3", "q1", "4");

        var leased = queue.leaseJobs(leaseRequest(CLUSTER));
        Assert.assertEquals(2, leased.getJobCount());
        Assert.assertTrue(h.lifecycle.get("j1").acked());
        Assert.assertTrue(h.lifecycle.get("j2").acked());

        var renewed = queue.renewLease(RenewLeaseRequest.newBuilder()
            .setClusterId(CLUSTER)
            .addAllIds(List.of("j1", "j2", "j3"))
            .build());
        Assert.assertEquals(List.of("j1", "j2"), renewed.getIdsList());

        queue.returnLease(ReturnLeaseRequest.newBuilder()
            .setClusterId(CLUSTER)
            .setJobId("j2")
            .setAvoidNodeLabels(OrderedStringMap.newBuilder()
                .addEntries(StringKeyValuePair.newBuilder().setKey("zone").setValue("a")))
            .setReason("pod evicted")
            .build());
        Assert.assertEquals(LeaseState.RETURNED, h.lifecycle.get("j2").state());
        Assert.assertEquals(Map.of("zone", "a"), h.jobs.avoidedLabels("j2", CLUSTER));

        var done = queue.reportDone(IdList.newBuilder().addIds("j1").addIds("j3").build());
        Assert.assertEquals(List.of("j1"), done.getIdsList());

        // j2 came back and j1 freed its share
        Assert.assertEquals(2, queue.leaseJobs(leaseRequest(CLUSTER)).getJobCount());
    }

    @Test
    public void testInvalidRequests() {
        Assert.assertEquals(Status.Code.INVALID_ARGUMENT, codeOf(() -> queue.leaseJobs(leaseRequest(""))));
        Assert.assertEquals(Status.Code.INVALID_ARGUMENT, codeOf(() -> queue.leaseJobs(leaseRequest(CLUSTER)
            .toBuilder().putResources("cpu", "lots").build())));
        Assert.assertEquals(Status.Code.INVALID_ARGUMENT, codeOf(() -> queue.leaseJobs(leaseRequest(CLUSTER)
            .toBuilder().putMinimumJobSize("cpu", "1e999999999").build())));
        Assert.assertEquals(Status.Code.INVALID_ARGUMENT,
            codeOf(() -> queue.renewLease(RenewLeaseRequest.newBuilder().addIds("j1").build())));
        Assert.assertEquals(Status.Code.INVALID_ARGUMENT,
            codeOf(() -> queue.returnLease(ReturnLeaseRequest.newBuilder().setClusterId(CLUSTER).build())));
    }

    @Test
    public void testReturnOfUnknownLeaseIsAccepted() {
        queue.returnLease(ReturnLeaseRequest.newBuilder().setClusterId(CLUSTER).setJobId("missing").build());
        Assert.assertNull(h.lifecycle.get("missing"));
    }

    @Test
    public void testStoreFailureIsUnavailable() throws Exception {
        h.submit("j1", "q1", "1");
        queue.leaseJobs(leaseRequest(CLUSTER));
        store.setFailing(true);

        Assert.assertEquals(Status.Code.UNAVAILABLE,
            codeOf(() -> queue.reportDone(IdList.newBuilder().addIds("j1").build())));
        Assert.assertEquals(LeaseState.ISSUED, h.lifecycle.get("j1").state());

        store.setFailing(false);
        Assert.assertEquals(List.of("j1"), queue.reportDone(IdList.newBuilder().addIds("j1").build()).getIdsList());
    }

    @Test
    public void testStreamingSession() throws Exception {
        h.submit("j1", "q1", "1");
        var received = new LinkedBlockingQueue<StreamingJobLease>();
        var closed = new LinkedBlockingQueue<Status>();
        var requests = AggregatedQueueGrpc.newStub(channel).streamingLeaseJobs(collect(received, closed));

        requests.onNext(StreamingLeaseRequest.newBuilder()
            .setClusterId(CLUSTER)
            .setPool("default")
            .putResources("cpu", "10")
            .build());
        var lease = received.poll(5, TimeUnit.SECONDS);
        Assert.assertNotNull(lease);
        Assert.assertEquals("j1", lease.getJob().getId());
        Assert.assertEquals(1, lease.getNumJobs());
        Assert.assertTrue(h.sessions.isOpen(POOL));

        // one-shot leasing is refused while the stream owns the pool
        Assert.assertEquals(Status.Code.ALREADY_EXISTS, codeOf(() -> queue.leaseJobs(leaseRequest(CLUSTER))));

        requests.onNext(StreamingLeaseRequest.newBuilder().addReceivedJobIds("j1").build());
        requests.onCompleted();
        Assert.assertEquals(Status.Code.OK, closed.poll(5, TimeUnit.SECONDS).getCode());

        Assert.assertFalse(h.sessions.isOpen(POOL));
        Assert.assertTrue(h.lifecycle.get("j1").acked());
        Assert.assertEquals(1, h.lifecycle.liveLeases(POOL).size());
    }

    @Test
    public void testSecondStreamForPoolRefused() throws Exception {
        var firstClosed = new LinkedBlockingQueue<Status>();
        var first = AggregatedQueueGrpc.newStub(channel)
            .streamingLeaseJobs(collect(new LinkedBlockingQueue<>(), firstClosed));
        first.onNext(StreamingLeaseRequest.newBuilder().setClusterId(CLUSTER).setPool("default").build());

        var secondClosed = new LinkedBlockingQueue<Status>();
        var second = AggregatedQueueGrpc.newStub(channel)
            .streamingLeaseJobs(collect(new LinkedBlockingQueue<>(), secondClosed));
        second.onNext(StreamingLeaseRequest.newBuilder().setClusterId(CLUSTER).setPool("default").build());

        Assert.assertEquals(Status.Code.ALREADY_EXISTS, secondClosed.poll(5, TimeUnit.SECONDS).getCode());
        Assert.assertTrue(firstClosed.isEmpty());
        Assert.assertTrue(h.sessions.isOpen(POOL));
        first.onCompleted();
    }

    @Test
    public void testOneShotCallHoldsPool() throws Exception {
        h.submit("j1", "q1", "1");
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var blockingLeaser = h.leaser(context -> {
            entered.countDown();
            release.await();
            return h.jobs.backlog("q1");
        }, Duration.ofSeconds(10));
        var config = new ServiceConfig();
        config.setResendAfter(Duration.ofMinutes(1));
        config.setMaxJobsPerBatch(10);
        var service = new AggregatedQueueService(blockingLeaser, h.lifecycle, h.sessions, h.metrics, config);

        var first = new Outcome<JobLease>();
        var caller = new Thread(() -> service.leaseJobs(leaseRequest(CLUSTER), first));
        caller.start();
        Assert.assertTrue(entered.await(5, TimeUnit.SECONDS));
        Assert.assertTrue(h.sessions.isOpen(POOL));

        var second = new Outcome<JobLease>();
        service.leaseJobs(leaseRequest(CLUSTER), second);
        Assert.assertEquals(Status.Code.ALREADY_EXISTS, second.closed.poll(5, TimeUnit.SECONDS).getCode());
        Assert.assertTrue(second.values.isEmpty());

        var stream = new Outcome<StreamingJobLease>();
        service.streamingLeaseJobs(stream).onNext(StreamingLeaseRequest.newBuilder()
            .setClusterId(CLUSTER)
            .setPool("default")
            .putResources("cpu", "10")
            .build());
        Assert.assertEquals(Status.Code.ALREADY_EXISTS, stream.closed.poll(5, TimeUnit.SECONDS).getCode());

        release.countDown();
        caller.join(5_000);
        Assert.assertEquals(Status.Code.OK, first.closed.poll(5, TimeUnit.SECONDS).getCode());
        Assert.assertEquals("j1", first.values.get(0).getJob(0).getId());
        Assert.assertFalse(h.sessions.isOpen(POOL));
        Assert.assertEquals(2.0, h.registry.getSampleValue("scheduler_rejected_sessions_total",
            new String[] {"reason"}, new String[] {"conflict"}), 0.0);
    }

    private static final class Outcome<T> implements StreamObserver<T> {
        final List<T> values = new CopyOnWriteArrayList<>();
        final BlockingQueue<Status> closed = new LinkedBlockingQueue<>();

        @Override
        public void onNext(T value) {
            values.add(value);
        }

        @Override
        public void onError(Throwable t) {
            closed.add(Status.fromThrowable(t));
        }

        @Override
        public void onCompleted() {
            closed.add(Status.OK);
        }
    }

    private static StreamObserver<StreamingJobLease> collect(BlockingQueue<StreamingJobLease> received,
                                                             BlockingQueue<Status> closed)
    {
        return new StreamObserver<>() {
            @Override
            public void onNext(StreamingJobLease value) {
                received.add(value);
            }

            @Override
            public void onError(Throwable t) {
                closed.add(Status.fromThrowable(t));
            }

            @Override
            public void onCompleted() {
                closed.add(Status.OK);
            }
        };
    }
}
