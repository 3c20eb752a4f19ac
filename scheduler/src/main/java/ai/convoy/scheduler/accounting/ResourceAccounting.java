package ai.convoy.scheduler.accounting;

import jakarta.inject.Singleton;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Singleton
public class ResourceAccounting {
    private final Map<PoolKey, PriorityResourceAccountant> accountants = new ConcurrentHashMap<>();

    public PriorityResourceAccountant accountant(PoolKey pool) {
        return accountants.computeIfAbsent(pool, PriorityResourceAccountant::new);
    }

    public Map<PoolKey, PriorityResourceAccountant> all() {
        return Map.copyOf(accountants);
    }
}
