package ai.convoy.scheduler.events;

import ai.convoy.scheduler.configs.ServiceConfig;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.UncheckedExecutionException;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutionException;

/**
 * Bounded least-recently-used cache of job-set handles in front of a {@link JobSetIdSource}. Concurrent misses
 * for the same job set share one lookup.
 */
@Singleton
public class JobSetIdMapper {
    private static final Logger LOG = LogManager.getLogger(JobSetIdMapper.class);

    private final LoadingCache<JobSetKey, Long> cache;
    private final JobSetIdSource source;

    @Inject
    public JobSetIdMapper(JobSetIdSource source, ServiceConfig config, Clock clock) {
        this(source, config.getJobSetCacheSize());
        preload(clock, config.getJobSetPreloadWindow());
    }

    public JobSetIdMapper(JobSetIdSource source, long maximumSize) {
        this.source = source;
        this.cache = CacheBuilder.newBuilder()
            .maximumSize(maximumSize)
            .build(new CacheLoader<>() {
                @Override
                public Long load(JobSetKey key) throws SQLException {
                    return source.getOrCreate(key);
                }
            });
    }

    public long get(String queue, String jobSetId) throws SQLException {
        try {
            return cache.get(new JobSetKey(queue, jobSetId));
        } catch (ExecutionException e) {
            if (e.getCause() instanceof SQLException sqlException) {
                throw sqlException;
            }
            throw new SQLException("Cannot resolve job set " + queue + "/" + jobSetId, e.getCause());
        } catch (UncheckedExecutionException e) {
            throw new IllegalStateException("Cannot resolve job set " + queue + "/" + jobSetId, e.getCause());
        }
    }

    public long size() {
        return cache.size();
    }

    private void preload(Clock clock, Duration window) {
        try {
            var recent = source.loadCreatedSince(clock.instant().minus(window));
            cache.putAll(recent);
            LOG.info("Preloaded {} job set handles", recent.size());
        } catch (SQLException e) {
            // handles still resolve one by one through the source
            LOG.warn("Cannot preload job set handles: {}", e.getMessage(), e);
        }
    }
}
