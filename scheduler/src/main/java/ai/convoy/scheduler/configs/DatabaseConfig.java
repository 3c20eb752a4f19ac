package ai.convoy.scheduler.configs;

import io.micronaut.context.annotation.ConfigurationProperties;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ConfigurationProperties("scheduler.database")
public class DatabaseConfig {
    private boolean enabled = false;
    private String url;
    private String username;
    private String password;
    private int minPoolSize = 1;
    private int maxPoolSize = 10;
}
