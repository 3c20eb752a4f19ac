package ai.convoy.scheduler.db;

/**
 * One persisted field: column name and the JDBC value bound to it.
 */
public record Column(String name, Object value) {
}
