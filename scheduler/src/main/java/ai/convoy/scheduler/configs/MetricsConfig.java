package ai.convoy.scheduler.configs;

import io.micronaut.context.annotation.ConfigurationProperties;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ConfigurationProperties("scheduler.metrics")
public class MetricsConfig {
    public enum Kind {
        Disabled,
        Logger,
        Prometheus
    }

    private Kind kind = Kind.Disabled;
    private int port = 17080;
    private String loggerName = "ai.convoy.scheduler.metrics";
    private String loggerLevel = "info";
}
