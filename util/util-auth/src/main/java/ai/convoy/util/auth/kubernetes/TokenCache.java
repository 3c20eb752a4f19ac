package ai.convoy.util.auth.kubernetes;

import com.google.common.base.Ticker;
import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Timer;
import java.util.TimerTask;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token verdicts keyed by raw token. Accepted tokens and rejected tokens are separate entry kinds
 * with their own time-to-live; expired entries are dropped on access and by {@link #sweep()}.
 */
public final class TokenCache implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(TokenCache.class);

    public enum Kind {
        VALID,
        INVALID
    }

    public record Entry(
        Kind kind,
        @Nullable String name,
        long expiresAtNanos
    ) {}

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Ticker ticker;
    private final Duration validTokenTtl;
    private final Duration invalidTokenTtl;
    @Nullable
    private Timer sweeper;

    public TokenCache(Ticker ticker, Duration validTokenTtl, Duration invalidTokenTtl) {
        this.ticker = ticker;
        this.validTokenTtl = validTokenTtl;
        this.invalidTokenTtl = invalidTokenTtl;
    }

    @Nullable
    public Entry get(String token) {
        var entry = entries.get(token);
        if (entry == null) {
            return null;
        }
        if (isExpired(entry, ticker.read())) {
            entries.remove(token, entry);
            return null;
        }
        return entry;
    }

    /**
     * Caches an accepted token for the shorter of the configured TTL and the token's remaining lifetime.
     */
    public void putValid(String token, String name, Duration tokenLifetime) {
        var ttl = tokenLifetime.compareTo(validTokenTtl) < 0 ? tokenLifetime : validTokenTtl;
        if (ttl.isNegative() || ttl.isZero()) {
            return;
        }
        entries.put(token, new Entry(Kind.VALID, name, ticker.read() + ttl.toNanos()));
    }

    public void putInvalid(String token) {
        if (invalidTokenTtl.isNegative() || invalidTokenTtl.isZero()) {
            return;
        }
        entries.put(token, new Entry(Kind.INVALID, null, ticker.read() + invalidTokenTtl.toNanos()));
    }

    public void evict(String token) {
        entries.remove(token);
    }

    public int sweep() {
        long now = ticker.read();
        int before = entries.size();
        entries.values().removeIf(entry -> isExpired(entry, now));
        int removed = before - entries.size();
        if (removed > 0) {
            LOG.debug("Swept {} expired token entries", removed);
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }

    public synchronized void startSweeping(Duration period) {
        if (sweeper != null) {
            throw new IllegalStateException("Token cache sweeper already started");
        }
        sweeper = new Timer("token-cache-sweeper", true);
        sweeper.scheduleAtFixedRate(new TimerTask() {
            @Override
            public void run() {
                sweep();
            }
        }, period.toMillis(), period.toMillis());
    }

    @Override
    public synchronized void close() {
        if (sweeper != null) {
            sweeper.cancel();
            sweeper = null;
        }
    }

    private static boolean isExpired(Entry entry, long nowNanos) {
        return nowNanos - entry.expiresAtNanos() >= 0;
    }
}
