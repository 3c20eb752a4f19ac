package ai.convoy.scheduler.events;

import ai.convoy.scheduler.db.SchedulerDataSource;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Singleton
@Requires(property = "scheduler.database.enabled", value = "true")
public class PostgresJobSetIdSource implements JobSetIdSource {
    private final SchedulerDataSource storage;

    public PostgresJobSetIdSource(SchedulerDataSource storage) {
        this.storage = storage;
    }

    @Override
    public long getOrCreate(JobSetKey key) throws SQLException {
        // the no-op update makes RETURNING yield the existing row on conflict
        try (var conn = storage.connect(); var st = conn.prepareStatement("""
            INSERT INTO job_sets (queue, job_set_id) VALUES (?, ?)
            ON CONFLICT (queue, job_set_id) DO UPDATE SET queue = EXCLUDED.queue
            RETURNING job_set_handle"""))
        {
            st.setString(1, key.queue());
            st.setString(2, key.jobSetId());
            try (var rs = st.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("No handle returned for job set " + key);
                }
                return rs.getLong(1);
            }
        }
    }

    @Override
    public Map<JobSetKey, Long> loadCreatedSince(Instant since) throws SQLException {
        try (var conn = storage.connect(); var st = conn.prepareStatement(
            "SELECT queue, job_set_id, job_set_handle FROM job_sets WHERE created_at >= ?"))
        {
            st.setTimestamp(1, Timestamp.from(since));
            var result = new HashMap<JobSetKey, Long>();
            try (var rs = st.executeQuery()) {
                while (rs.next()) {
                    result.put(new JobSetKey(rs.getString(1), rs.getString(2)), rs.getLong(3));
                }
            }
            return result;
        }
    }
}
