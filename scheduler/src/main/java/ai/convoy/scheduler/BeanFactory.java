package ai.convoy.scheduler;

import ai.convoy.scheduler.configs.KubernetesAuthConfig;
import ai.convoy.scheduler.configs.MetricsConfig;
import ai.convoy.scheduler.configs.ServiceConfig;
import ai.convoy.scheduler.db.SchemaRegistry;
import ai.convoy.scheduler.jobs.PriorityClasses;
import ai.convoy.scheduler.metrics.LogMetricReporter;
import ai.convoy.scheduler.metrics.MetricReporter;
import ai.convoy.scheduler.metrics.PrometheusMetricReporter;
import ai.convoy.scheduler.nodes.NodeTypeClassifier;
import ai.convoy.util.auth.AuthenticateService;
import ai.convoy.util.auth.kubernetes.KubernetesNativeAuthService;
import ai.convoy.util.auth.kubernetes.KubernetesTokenReviewer;
import ai.convoy.util.auth.kubernetes.TokenCache;
import com.google.common.base.Ticker;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import io.prometheus.client.CollectorRegistry;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.Level;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Factory
public class BeanFactory {

    @Singleton
    public Ticker ticker() {
        return Ticker.systemTicker();
    }

    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Singleton
    public PriorityClasses priorityClasses(ServiceConfig config) {
        return new PriorityClasses(config.getPriorityClasses(), config.getDefaultPriorityClass());
    }

    @Singleton
    public NodeTypeClassifier nodeTypeClassifier(ServiceConfig config, PriorityClasses priorityClasses) {
        return new NodeTypeClassifier(config.getIgnoredNodeLabels(), priorityClasses.values());
    }

    @Singleton
    public CollectorRegistry collectorRegistry() {
        CollectorRegistry.defaultRegistry.clear();
        return CollectorRegistry.defaultRegistry;
    }

    @Singleton
    public MetricReporter metricReporter(MetricsConfig config, CollectorRegistry registry) {
        return switch (config.getKind()) {
            case Disabled -> MetricReporter.disabled();
            case Logger -> new LogMetricReporter(config.getLoggerName(),
                Level.valueOf(config.getLoggerLevel().toUpperCase()), registry);
            case Prometheus -> new PrometheusMetricReporter(config.getPort(), registry);
        };
    }

    @Bean(preDestroy = "shutdownNow")
    @Singleton
    @Named("OracleExecutor")
    public ExecutorService oracleExecutor(ServiceConfig config) {
        return Executors.newFixedThreadPool(config.getOracleThreads(), new ThreadFactoryBuilder()
            .setNameFormat("fairness-oracle-%d")
            .setDaemon(true)
            .build());
    }

    @Singleton
    @Requires(property = "scheduler.database.enabled", value = "true")
    public SchemaRegistry schemaRegistry() {
        return SchemaRegistry.fromClasspath(List.of("db/scheduler/migrations/V1__initial.sql"));
    }

    @Bean(preDestroy = "close")
    @Singleton
    @Requires(property = "scheduler.auth.kubernetes.enabled", value = "true")
    public TokenCache tokenCache(KubernetesAuthConfig config, Ticker ticker) {
        var cache = new TokenCache(ticker, config.getValidTokenExpiry(), config.getInvalidTokenExpiry());
        cache.startSweeping(config.getCacheSweepPeriod());
        return cache;
    }

    @Singleton
    @Requires(property = "scheduler.auth.kubernetes.enabled", value = "true")
    public AuthenticateService authenticateService(KubernetesAuthConfig config, TokenCache cache, Clock clock) {
        return new KubernetesNativeAuthService(config.getKidMappingFileLocation(), cache,
            new KubernetesTokenReviewer(), clock);
    }
}
