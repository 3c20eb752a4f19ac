package ai.convoy.scheduler.configs;

import io.micronaut.context.annotation.ConfigurationProperties;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@ConfigurationProperties("scheduler")
public class ServiceConfig {
    public enum JobOrder {
        LOWER_FIRST,
        HIGHER_FIRST
    }

    private String address;

    private Duration leaseTtl = Duration.ofMinutes(5);
    private Duration expirationPeriod = Duration.ofSeconds(10);
    private Duration terminalLeaseRetention = Duration.ofHours(1);

    private int maxJobsPerBatch = 100;
    private Duration resendAfter = Duration.ofMinutes(1);
    private Duration oracleTimeout = Duration.ofSeconds(10);
    private int oracleThreads = 4;
    private JobOrder jobOrder = JobOrder.LOWER_FIRST;

    private Map<String, Integer> priorityClasses = Map.of("default", 0);
    private String defaultPriorityClass = "default";

    private List<String> ignoredNodeLabels = List.of("kubernetes.io/hostname");

    private Duration clusterReportTtl = Duration.ofMinutes(10);

    private int jobSetCacheSize = 10_000;
    private Duration jobSetPreloadWindow = Duration.ofHours(24);

    @PostConstruct
    public void validate() {
        requirePositive("lease-ttl", leaseTtl);
        requirePositive("expiration-period", expirationPeriod);
        requirePositive("resend-after", resendAfter);
        requirePositive("oracle-timeout", oracleTimeout);
        requirePositive("cluster-report-ttl", clusterReportTtl);
        if (maxJobsPerBatch <= 0) {
            throw new IllegalStateException("scheduler.max-jobs-per-batch must be positive, got " + maxJobsPerBatch);
        }
        if (oracleThreads <= 0) {
            throw new IllegalStateException("scheduler.oracle-threads must be positive, got " + oracleThreads);
        }
        if (jobSetCacheSize <= 0) {
            throw new IllegalStateException("scheduler.job-set-cache-size must be positive, got " + jobSetCacheSize);
        }
        if (!priorityClasses.containsKey(defaultPriorityClass)) {
            throw new IllegalStateException("scheduler.default-priority-class '" + defaultPriorityClass
                + "' is not one of " + priorityClasses.keySet());
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalStateException("scheduler." + name + " must be positive, got " + value);
        }
    }
}
