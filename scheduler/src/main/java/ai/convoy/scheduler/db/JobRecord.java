package ai.convoy.scheduler.db;

import ai.convoy.scheduler.jobs.Job;
import ai.convoy.v1.QueueApi;
import com.google.protobuf.InvalidProtocolBufferException;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;

/**
 * Persisted form of a job. The job itself is stored as its protobuf encoding; the other columns exist for
 * querying.
 */
public record JobRecord(Job job, boolean archived) {
    public static final String TABLE = "jobs";
    public static final String KEY = "job_id";
    public static final List<String> COLUMNS = List.of(
        "job_id", "queue", "job_set_id", "priority", "submitted_at", "archived", "payload");

    public List<Column> columns() {
        return List.of(
            new Column("job_id", job.id()),
            new Column("queue", job.queue()),
            new Column("job_set_id", job.jobSetId()),
            new Column("priority", job.priority()),
            new Column("submitted_at", Timestamp.from(job.created())),
            new Column("archived", archived),
            new Column("payload", job.toProto().toByteArray()));
    }

    public static JobRecord fromResultSet(ResultSet rs) throws SQLException {
        try {
            var job = Job.fromProto(QueueApi.Job.parseFrom(rs.getBytes("payload")));
            return new JobRecord(job, rs.getBoolean("archived"));
        } catch (InvalidProtocolBufferException e) {
            throw new SQLException("Malformed payload of job " + rs.getString("job_id"), e);
        }
    }
}
