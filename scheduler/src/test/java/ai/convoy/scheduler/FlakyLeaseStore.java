package ai.convoy.scheduler;

import ai.convoy.scheduler.db.InMemoryLeaseStore;
import ai.convoy.scheduler.db.LeaseRecord;
import ai.convoy.scheduler.db.LeaseStore;
import ai.convoy.scheduler.jobs.Job;

import java.sql.SQLException;
import java.util.Collection;
import java.util.List;

/**
 * In-memory store whose writes fail while {@link #failing} is set.
 */
public class FlakyLeaseStore implements LeaseStore {
    private final InMemoryLeaseStore delegate = new InMemoryLeaseStore();
    private volatile boolean failing = false;

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    private void check() throws SQLException {
        if (failing) {
            throw new SQLException("Store is unavailable", "08006");
        }
    }

    @Override
    public void saveJobs(Collection<Job> jobs) throws SQLException {
        check();
        delegate.saveJobs(jobs);
    }

    @Override
    public void archiveJobs(Collection<String> jobIds) throws SQLException {
        check();
        delegate.archiveJobs(jobIds);
    }

    @Override
    public void saveLeases(Collection<LeaseRecord> leases) throws SQLException {
        check();
        delegate.saveLeases(leases);
    }

    @Override
    public void deleteTerminalLeases(Collection<String> jobIds) throws SQLException {
        check();
        delegate.deleteTerminalLeases(jobIds);
    }

    @Override
    public List<Job> loadJobs() {
        return delegate.loadJobs();
    }

    @Override
    public List<LeaseRecord> loadLiveLeases() {
        return delegate.loadLiveLeases();
    }
}
