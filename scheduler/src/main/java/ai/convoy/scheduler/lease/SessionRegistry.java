package ai.convoy.scheduler.lease;

import ai.convoy.scheduler.accounting.PoolKey;
import jakarta.annotation.Nullable;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * At most one holder per cluster/pool: either a streaming session or a one-shot {@code LeaseJobs} call
 * in flight. A newer claim on an occupied pool is refused.
 */
@Singleton
public class SessionRegistry {
    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private record Holder(String id, @Nullable LeaseSession session) {}

    private final Map<PoolKey, Holder> holders = new ConcurrentHashMap<>();

    public boolean register(PoolKey pool, LeaseSession session) {
        return claim(pool, new Holder(session.id(), session));
    }

    public void unregister(PoolKey pool, LeaseSession session) {
        holders.remove(pool, new Holder(session.id(), session));
    }

    public boolean registerCall(PoolKey pool, String callId) {
        return claim(pool, new Holder(callId, null));
    }

    public void unregisterCall(PoolKey pool, String callId) {
        holders.remove(pool, new Holder(callId, null));
    }

    public boolean isOpen(PoolKey pool) {
        return holders.containsKey(pool);
    }

    public int size() {
        return holders.size();
    }

    /**
     * Completes every open stream. Leases stay issued.
     */
    public void drainAll() {
        List<LeaseSession> open = holders.values().stream()
            .map(Holder::session)
            .filter(Objects::nonNull)
            .toList();
        LOG.info("Draining {} lease sessions", open.size());
        open.forEach(LeaseSession::drain);
    }

    private boolean claim(PoolKey pool, Holder holder) {
        var existing = holders.putIfAbsent(pool, holder);
        if (existing != null) {
            LOG.warn("Refuse {} for {}: {} already holds it", holder.id(), pool, existing.id());
            return false;
        }
        return true;
    }
}
