package ai.convoy.scheduler.lifecycle;

import java.util.List;

/**
 * Leases sent to an executor as one unit.
 *
 * @param members every lease of the batch, in selection order
 * @param unacked members the executor has not confirmed yet; only these are sent
 */
public record LeaseBatch(long batchId, List<Lease> members, List<Lease> unacked) {
    public int numJobs() {
        return members.size();
    }

    public int numAcked() {
        return members.size() - unacked.size();
    }
}
