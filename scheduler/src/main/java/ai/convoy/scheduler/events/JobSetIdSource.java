package ai.convoy.scheduler.events;

import java.sql.SQLException;
import java.time.Instant;
import java.util.Map;

/**
 * Authoritative mapping of job sets to integer handles.
 */
public interface JobSetIdSource {

    /**
     * Returns the handle of the job set, allocating one on first use.
     */
    long getOrCreate(JobSetKey key) throws SQLException;

    /**
     * Handles of job sets created at or after {@code since}.
     */
    Map<JobSetKey, Long> loadCreatedSince(Instant since) throws SQLException;
}
