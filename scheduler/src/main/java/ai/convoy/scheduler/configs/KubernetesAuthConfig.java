package ai.convoy.scheduler.configs;

import io.micronaut.context.annotation.ConfigurationProperties;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties("scheduler.auth.kubernetes")
public class KubernetesAuthConfig {
    private boolean enabled = false;
    private String kidMappingFileLocation;
    private Duration invalidTokenExpiry = Duration.ofMinutes(1);
    private Duration validTokenExpiry = Duration.ofHours(1);
    private Duration cacheSweepPeriod = Duration.ofMinutes(1);
}
