package ai.convoy.scheduler.accounting;

public record PoolKey(String clusterId, String pool) {
    @Override
    public String toString() {
        return clusterId + "/" + pool;
    }
}
