package adsentry.spi;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import adsentry.core.model.lockout.LockoutStatus;

/**
 * SPI for the ephemeral side of lockout tracking: failed attempt counters and
 * cached lockout decisions.
 *
 * <p>Platform teams can provide custom implementations for their preferred
 * storage backend (e.g., Memcached via AWS ElastiCache).
 * Everything kept here is a hint with a TTL; the
 * {@link adsentry.core.port.out.AttemptStore} remains authoritative.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Increment operations MUST be atomic</li>
 *   <li>Entries MUST expire automatically based on the given TTL</li>
 *   <li>All operations MUST be non-blocking (return Uni)</li>
 *   <li>Implementations SHOULD be thread-safe</li>
 * </ul>
 *
 * <h2>Key Format</h2>
 * <p>Keys are built by {@link adsentry.core.model.lockout.LockoutKeys}. Patterns
 * use {@code *} as the only wildcard.
 *
 * <h2>Registration</h2>
 * Platform teams register custom implementations via CDI:
 * <pre>{@code
 * @Alternative
 * @Priority(1)
 * @ApplicationScoped
 * public class MemcachedAttemptCache implements AttemptCache {
 *     // Custom implementation
 * }
 * }</pre>
 *
 * @see adsentry.adapter.out.storage.redis.RedisAttemptCache
 * @see adsentry.adapter.out.storage.memory.InMemoryAttemptCache
 */
public interface AttemptCache {

    /**
     * Increment a counter, creating it with the given TTL if it does not exist.
     *
     * <p>The TTL is set only when the counter is created, so the window is not
     * extended by later increments.
     *
     * @param key    counter key
     * @param window TTL of a newly created counter
     * @return Uni with the counter value after incrementing
     */
    Uni<Long> increment(String key, Duration window);

    /**
     * Read a cached lockout status.
     *
     * @param key status key
     * @return Uni with the status, or empty on a miss
     */
    Uni<Optional<LockoutStatus>> getStatus(String key);

    /**
     * Cache a lockout status.
     *
     * @param key    status key
     * @param status the status
     * @param ttl    time to live, must be positive
     * @return Uni completing when cached
     */
    Uni<Void> putStatus(String key, LockoutStatus status, Duration ttl);

    /**
     * Delete one key.
     *
     * @param key the key
     * @return Uni completing when deleted
     */
    Uni<Void> delete(String key);

    /**
     * Delete every key matching a glob pattern such as {@code failed_login:jdoe:*}.
     *
     * @param pattern key pattern
     * @return Uni with the number of keys deleted
     */
    Uni<Long> deleteMatching(String pattern);
}
