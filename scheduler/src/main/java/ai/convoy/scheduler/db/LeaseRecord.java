package ai.convoy.scheduler.db;

import ai.convoy.scheduler.lifecycle.LeaseState;
import ai.convoy.scheduler.resources.ComputeResources;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persisted form of a lease.
 */
public record LeaseRecord(
    String jobId,
    String clusterId,
    String pool,
    int priorityClass,
    ComputeResources resources,
    LeaseState state,
    boolean acked,
    long batchId,
    Instant updatedAt
) {
    public static final String TABLE = "leases";
    public static final String KEY = "job_id";
    public static final List<String> COLUMNS = List.of(
        "job_id", "cluster_id", "pool", "priority_class", "resources_json", "state", "acked", "batch_id",
        "updated_at");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public List<Column> columns() {
        return List.of(
            new Column("job_id", jobId),
            new Column("cluster_id", clusterId),
            new Column("pool", pool),
            new Column("priority_class", priorityClass),
            new Column("resources_json", toJson(resources)),
            new Column("state", state.name()),
            new Column("acked", acked),
            new Column("batch_id", batchId),
            new Column("updated_at", Timestamp.from(updatedAt)));
    }

    public static LeaseRecord fromResultSet(ResultSet rs) throws SQLException {
        return new LeaseRecord(
            rs.getString("job_id"),
            rs.getString("cluster_id"),
            rs.getString("pool"),
            rs.getInt("priority_class"),
            fromJson(rs.getString("resources_json")),
            LeaseState.valueOf(rs.getString("state")),
            rs.getBoolean("acked"),
            rs.getLong("batch_id"),
            rs.getTimestamp("updated_at").toInstant());
    }

    static String toJson(ComputeResources resources) {
        try {
            return MAPPER.writeValueAsString(resources.asMap());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize resources " + resources, e);
        }
    }

    static ComputeResources fromJson(String json) throws SQLException {
        try {
            return ComputeResources.ofMillis(MAPPER.readValue(json, new TypeReference<Map<String, Long>>() {}));
        } catch (JsonProcessingException e) {
            throw new SQLException("Malformed resources column: " + json, e);
        }
    }
}
