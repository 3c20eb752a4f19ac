package ai.convoy.scheduler.events;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@Singleton
@Requires(property = "scheduler.database.enabled", notEquals = "true")
public class InMemoryJobSetIdSource implements JobSetIdSource {
    private record Handle(long id, Instant createdAt) {}

    private final Map<JobSetKey, Handle> handles = new LinkedHashMap<>();
    private final Clock clock;
    private long nextId = 1;

    public InMemoryJobSetIdSource(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized long getOrCreate(JobSetKey key) {
        return handles.computeIfAbsent(key, k -> new Handle(nextId++, clock.instant())).id();
    }

    @Override
    public synchronized Map<JobSetKey, Long> loadCreatedSince(Instant since) {
        var result = new HashMap<JobSetKey, Long>();
        handles.forEach((key, handle) -> {
            if (!handle.createdAt().isBefore(since)) {
                result.put(key, handle.id());
            }
        });
        return result;
    }
}
