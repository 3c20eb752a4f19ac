package ai.convoy.scheduler.db;

import ai.convoy.scheduler.lifecycle.LeaseState;
import ai.convoy.scheduler.resources.ComputeResources;
import org.junit.Assert;
import org.junit.Test;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public class InMemoryLeaseStoreTest {
    private final InMemoryLeaseStore store = new InMemoryLeaseStore();

    private static LeaseRecord lease(String jobId, LeaseState state) {
        return new LeaseRecord(jobId, "cluster-a", "default", 0, ComputeResources.of("cpu", "1"), state, false,
            1, Instant.EPOCH);
    }

    @Test
    public void testOnlyLiveLeasesLoaded() {
        store.saveLeases(List.of(lease("j1", LeaseState.ISSUED), lease("j2", LeaseState.DONE)));
        store.saveLeases(List.of(lease("j3", LeaseState.RENEWED)));

        Assert.assertEquals(List.of("j1", "j3"),
            store.loadLiveLeases().stream().map(LeaseRecord::jobId).sorted().toList());
    }

    @Test
    public void testDeleteKeepsReissuedLease() {
        store.saveLeases(List.of(lease("j1", LeaseState.EXPIRED), lease("j2", LeaseState.RETURNED)));
        // j1 was leased again before the purge
        store.saveLeases(List.of(lease("j1", LeaseState.ISSUED)));

        store.deleteTerminalLeases(List.of("j1", "j2"));

        Assert.assertEquals(List.of("j1"), store.loadLiveLeases().stream().map(LeaseRecord::jobId).toList());
    }

    @Test
    public void testResourcesJson() throws SQLException {
        var resources = ComputeResources.parse(Map.of("cpu", "1500m", "memory", "2Gi"));

        Assert.assertEquals(resources, LeaseRecord.fromJson(LeaseRecord.toJson(resources)));
        Assert.assertThrows(SQLException.class, () -> LeaseRecord.fromJson("{cpu"));
    }
}
