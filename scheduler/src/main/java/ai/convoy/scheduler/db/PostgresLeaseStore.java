package ai.convoy.scheduler.db;

import ai.convoy.scheduler.jobs.Job;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

@Singleton
@Requires(property = "scheduler.database.enabled", value = "true")
public class PostgresLeaseStore implements LeaseStore {
    private static final String UPSERT_LEASE = Statements.upsert(LeaseRecord.TABLE, LeaseRecord.COLUMNS,
        LeaseRecord.KEY);

    private static final String INSERT_JOB = "INSERT INTO " + JobRecord.TABLE
        + " (" + String.join(", ", JobRecord.COLUMNS) + ") VALUES ("
        + String.join(", ", JobRecord.COLUMNS.stream().map(c -> "?").toList())
        + ") ON CONFLICT (" + JobRecord.KEY + ") DO NOTHING";

    private final SchedulerDataSource storage;

    public PostgresLeaseStore(SchedulerDataSource storage, SchemaRegistry schema) {
        schema.requireColumns(LeaseRecord.TABLE, LeaseRecord.COLUMNS);
        schema.requireColumns(JobRecord.TABLE, JobRecord.COLUMNS);
        this.storage = storage;
    }

    @Override
    public void saveJobs(Collection<Job> jobs) throws SQLException {
        try (var conn = storage.connect()) {
            inTransaction(conn, () -> {
                try (var st = conn.prepareStatement(INSERT_JOB)) {
                    for (var job : jobs) {
                        Statements.bind(st, JobRecord.COLUMNS, new JobRecord(job, false).columns());
                        st.addBatch();
                    }
                    st.executeBatch();
                }
            });
        }
    }

    @Override
    public void archiveJobs(Collection<String> jobIds) throws SQLException {
        try (var conn = storage.connect(); var st = conn.prepareStatement(
            "UPDATE jobs SET archived = TRUE WHERE job_id = ANY(?)"))
        {
            st.setArray(1, conn.createArrayOf("text", jobIds.toArray()));
            st.executeUpdate();
        }
    }

    @Override
    public void saveLeases(Collection<LeaseRecord> leases) throws SQLException {
        try (var conn = storage.connect()) {
            inTransaction(conn, () -> {
                try (var st = conn.prepareStatement(UPSERT_LEASE)) {
                    for (var lease : leases) {
                        Statements.bind(st, LeaseRecord.COLUMNS, lease.columns());
                        st.addBatch();
                    }
                    st.executeBatch();
                }
            });
        }
    }

    @Override
    public void deleteTerminalLeases(Collection<String> jobIds) throws SQLException {
        try (var conn = storage.connect(); var st = conn.prepareStatement(
            "DELETE FROM leases WHERE job_id = ANY(?) AND state NOT IN ('ISSUED', 'RENEWED')"))
        {
            st.setArray(1, conn.createArrayOf("text", jobIds.toArray()));
            st.executeUpdate();
        }
    }

    @Override
    public List<Job> loadJobs() throws SQLException {
        try (var conn = storage.connect(); var st = conn.prepareStatement(
            "SELECT " + String.join(", ", JobRecord.COLUMNS)
                + " FROM jobs WHERE NOT archived ORDER BY submitted_at"))
        {
            var jobs = new ArrayList<Job>();
            try (var rs = st.executeQuery()) {
                while (rs.next()) {
                    jobs.add(JobRecord.fromResultSet(rs).job());
                }
            }
            return jobs;
        }
    }

    @Override
    public List<LeaseRecord> loadLiveLeases() throws SQLException {
        try (var conn = storage.connect(); var st = conn.prepareStatement(
            "SELECT " + String.join(", ", LeaseRecord.COLUMNS)
                + " FROM leases WHERE state IN ('ISSUED', 'RENEWED')"))
        {
            var leases = new ArrayList<LeaseRecord>();
            try (var rs = st.executeQuery()) {
                while (rs.next()) {
                    leases.add(LeaseRecord.fromResultSet(rs));
                }
            }
            return leases;
        }
    }

    private interface SqlBlock {
        void run() throws SQLException;
    }

    private static void inTransaction(Connection conn, SqlBlock block) throws SQLException {
        conn.setAutoCommit(false);
        try {
            block.run();
            conn.commit();
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        }
    }
}
