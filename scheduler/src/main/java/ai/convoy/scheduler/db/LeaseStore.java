package ai.convoy.scheduler.db;

import ai.convoy.scheduler.jobs.Job;

import java.sql.SQLException;
import java.util.Collection;
import java.util.List;

/**
 * Durable record of jobs and leases. Failures surface as {@link SQLException} and are retryable from the
 * caller's point of view.
 */
public interface LeaseStore {

    void saveJobs(Collection<Job> jobs) throws SQLException;

    void archiveJobs(Collection<String> jobIds) throws SQLException;

    /**
     * Inserts or replaces leases by job id.
     */
    void saveLeases(Collection<LeaseRecord> leases) throws SQLException;

    /**
     * Deletes the named leases unless they are live again.
     */
    void deleteTerminalLeases(Collection<String> jobIds) throws SQLException;

    /**
     * Jobs not archived yet, in submission order.
     */
    List<Job> loadJobs() throws SQLException;

    /**
     * Leases in state ISSUED or RENEWED.
     */
    List<LeaseRecord> loadLiveLeases() throws SQLException;
}
