package ai.convoy.scheduler.oracle;

import ai.convoy.scheduler.jobs.Job;

import java.util.List;

/**
 * Queue-fairness policy. Decides which queued jobs a pool should be offered next, most urgent first; the
 * caller still checks each job against node and priority headroom and may admit fewer.
 */
public interface FairnessOracle {

    /**
     * @return at most {@code context.maxJobs()} queued jobs
     */
    List<Job> selectJobs(SchedulingContext context) throws Exception;
}
