package ai.convoy.scheduler;

import ai.convoy.scheduler.configs.ServiceConfig;
import ai.convoy.scheduler.lease.SessionRegistry;
import ai.convoy.scheduler.lifecycle.LeaseExpirationCollector;
import ai.convoy.scheduler.lifecycle.LeaseLifecycleManager;
import ai.convoy.scheduler.metrics.MetricReporter;
import ai.convoy.scheduler.services.AggregatedQueueService;
import ai.convoy.scheduler.services.SubmitService;
import ai.convoy.util.auth.AuthenticateService;
import ai.convoy.util.auth.grpc.AuthServerInterceptor;
import com.google.common.net.HostAndPort;
import io.grpc.Server;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.runtime.Micronaut;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.sql.SQLException;

import static ai.convoy.util.grpc.GrpcUtils.NO_AUTH;
import static ai.convoy.util.grpc.GrpcUtils.newGrpcServer;

@Singleton
public class SchedulerMain {
    private static final Logger LOG = LogManager.getLogger(SchedulerMain.class);

    private final ServiceConfig config;
    private final Server server;
    private final LeaseLifecycleManager lifecycle;
    private final LeaseExpirationCollector expiration;
    private final SessionRegistry sessions;
    private final MetricReporter metricReporter;

    public SchedulerMain(ServiceConfig config, AggregatedQueueService queueService, SubmitService submitService,
                         LeaseLifecycleManager lifecycle, LeaseExpirationCollector expiration,
                         SessionRegistry sessions, MetricReporter metricReporter,
                         @Nullable AuthenticateService authService)
    {
        this.config = config;
        this.lifecycle = lifecycle;
        this.expiration = expiration;
        this.sessions = sessions;
        this.metricReporter = metricReporter;

        if (authService == null) {
            LOG.warn("Kubernetes authentication is disabled, executors are not authenticated");
        }

        var address = HostAndPort.fromString(config.getAddress());
        this.server = newGrpcServer(address, authService == null ? NO_AUTH : new AuthServerInterceptor(authService))
            .addService(queueService)
            .addService(submitService)
            .build();
    }

    public void start() throws IOException, SQLException {
        LOG.info("Starting scheduler at {}...", config.getAddress());
        lifecycle.restore();
        metricReporter.start();
        server.start();
    }

    public void stop() {
        LOG.info("Shutdown scheduler at {}...", config.getAddress());
        server.shutdown();
        sessions.drainAll();
        expiration.shutdown();
        metricReporter.stop();
    }

    public void awaitTermination() throws InterruptedException {
        server.awaitTermination();
    }

    public static void main(String[] args) throws IOException, SQLException, InterruptedException {
        final var context = Micronaut.build(args)
            .banner(true)
            .deduceEnvironment(true)
            .eagerInitSingletons(true)
            .mainClass(SchedulerMain.class)
            .defaultEnvironments("local")
            .start();

        final var main = context.getBean(SchedulerMain.class);
        main.start();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Stopping scheduler service");
            main.stop();
        }));
        main.awaitTermination();
    }
}
