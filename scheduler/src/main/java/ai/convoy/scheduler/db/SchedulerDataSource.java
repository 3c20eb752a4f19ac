package ai.convoy.scheduler.db;

import ai.convoy.scheduler.configs.DatabaseConfig;
import com.mchange.v2.c3p0.ComboPooledDataSource;
import io.micronaut.context.annotation.Requires;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.flywaydb.core.Flyway;

import java.sql.Connection;
import java.sql.SQLException;

@Singleton
@Requires(property = "scheduler.database.enabled", value = "true")
public class SchedulerDataSource {
    private static final Logger LOG = LogManager.getLogger(SchedulerDataSource.class);

    public static final String MIGRATIONS_LOCATION = "classpath:db/scheduler/migrations";

    private static final String VALIDATION_QUERY_SQL = "select 1";

    private final ComboPooledDataSource dataSource;

    public SchedulerDataSource(DatabaseConfig config) {
        dataSource = new ComboPooledDataSource();
        dataSource.setJdbcUrl(config.getUrl());
        dataSource.setUser(config.getUsername());
        dataSource.setPassword(config.getPassword());

        dataSource.setMinPoolSize(config.getMinPoolSize());
        dataSource.setMaxPoolSize(config.getMaxPoolSize());

        dataSource.setTestConnectionOnCheckout(true);
        dataSource.setPreferredTestQuery(VALIDATION_QUERY_SQL);

        var flyway = Flyway.configure()
            .dataSource(config.getUrl(), config.getUsername(), config.getPassword())
            .locations(MIGRATIONS_LOCATION)
            .load();
        var result = flyway.migrate();
        LOG.info("Applied {} migrations to {}", result.migrationsExecuted, config.getUrl());
    }

    public Connection connect() throws SQLException {
        var conn = dataSource.getConnection();
        conn.setAutoCommit(true);
        conn.setTransactionIsolation(Connection.TRANSACTION_REPEATABLE_READ);
        return conn;
    }

    @PreDestroy
    public void close() {
        dataSource.close();
    }
}
