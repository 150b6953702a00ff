package adsentry.adapter.out.storage.memory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

import jakarta.annotation.PreDestroy;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import adsentry.core.model.lockout.LockoutStatus;
import adsentry.spi.AttemptCache;

/**
 * In-memory implementation of AttemptCache.
 *
 * <p>
 * This implementation is intended for development and testing only.
 * Counters and cached statuses are lost on restart and not shared across
 * instances.
 *
 * <p>
 * <strong>Warning:</strong> Do not use in production with multiple instances.
 */
public class InMemoryAttemptCache implements AttemptCache {

    private static final Logger LOG = Logger.getLogger(InMemoryAttemptCache.class);

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final ScheduledExecutorService cleanupExecutor;

    public InMemoryAttemptCache() {
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "attempt-cache-cleanup");
            t.setDaemon(true);
            return t;
        });

        // Run cleanup every minute
        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpired, 1, 1, TimeUnit.MINUTES);
        LOG.info("Initialized in-memory attempt cache");
    }

    @Override
    public Uni<Long> increment(String key, Duration window) {
        return Uni.createFrom().item(() -> {
            final var now = Instant.now();
            final var entry = entries.compute(key, (k, existing) -> {
                if (existing == null || existing.isExpiredAt(now) || existing.counter() == null) {
                    // Window starts with the first attempt and is not extended afterwards
                    return Entry.counter(1L, now.plus(window));
                }
                return Entry.counter(existing.counter() + 1, existing.expiresAt());
            });
            LOG.debugf("Incremented %s: count=%d, expires=%s", key, entry.counter(), entry.expiresAt());
            return entry.counter();
        });
    }

    @Override
    public Uni<Optional<LockoutStatus>> getStatus(String key) {
        return Uni.createFrom().item(() -> {
            final var entry = entries.get(key);
            if (entry == null || entry.status() == null) {
                return Optional.empty();
            }
            if (entry.isExpiredAt(Instant.now())) {
                entries.remove(key, entry);
                return Optional.empty();
            }
            return Optional.of(entry.status());
        });
    }

    @Override
    public Uni<Void> putStatus(String key, LockoutStatus status, Duration ttl) {
        return Uni.createFrom().item(() -> {
            entries.put(key, Entry.status(status, Instant.now().plus(ttl)));
            return null;
        });
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().item(() -> {
            entries.remove(key);
            return null;
        });
    }

    @Override
    public Uni<Long> deleteMatching(String pattern) {
        return Uni.createFrom().item(() -> {
            final var regex = globToRegex(pattern);
            final var before = entries.size();
            entries.keySet().removeIf(key -> regex.matcher(key).matches());
            final long removed = before - entries.size();
            LOG.debugf("Deleted %d keys matching %s", removed, pattern);
            return removed;
        });
    }

    /**
     * Translates a Redis glob pattern. A backslash makes the next character literal;
     * {@code *} and {@code ?} are wildcards and {@code [...]} matches one of the listed
     * characters (ranges are not expanded).
     */
    static Pattern globToRegex(String glob) {
        final var regex = new StringBuilder();
        final var literal = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            final var c = glob.charAt(i);
            if (c == '\\' && i + 1 < glob.length()) {
                literal.append(glob.charAt(i + 1));
                i += 2;
                continue;
            }
            final var closing = c == '[' ? glob.indexOf(']', i + 1) : -1;
            if (c != '*' && c != '?' && closing < 0) {
                literal.append(c);
                i++;
                continue;
            }
            if (literal.length() > 0) {
                regex.append(Pattern.quote(literal.toString()));
                literal.setLength(0);
            }
            if (c == '*') {
                regex.append(".*");
                i++;
            } else if (c == '?') {
                regex.append('.');
                i++;
            } else {
                final var members = glob.substring(i + 1, closing);
                final var negated = members.startsWith("^");
                regex.append(negated ? "[^" : "[")
                        .append(Pattern.quote(negated ? members.substring(1) : members))
                        .append(']');
                i = closing + 1;
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private void cleanupExpired() {
        final var now = Instant.now();
        final var before = entries.size();
        entries.entrySet().removeIf(entry -> entry.getValue().isExpiredAt(now));
        final var removed = before - entries.size();
        if (removed > 0) {
            LOG.debugf("Cleaned up %d expired attempt cache entries", removed);
        }
    }

    /**
     * Shuts down the cleanup executor.
     */
    @PreDestroy
    public void shutdown() {
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Get the current count of cached keys (for testing).
     */
    public int size() {
        return entries.size();
    }

    private record Entry(Long counter, LockoutStatus status, Instant expiresAt) {

        static Entry counter(long value, Instant expiresAt) {
            return new Entry(value, null, expiresAt);
        }

        static Entry status(LockoutStatus status, Instant expiresAt) {
            return new Entry(null, status, expiresAt);
        }

        boolean isExpiredAt(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
