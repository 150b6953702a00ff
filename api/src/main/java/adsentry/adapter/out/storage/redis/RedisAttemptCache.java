package adsentry.adapter.out.storage.redis;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.arc.DefaultBean;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import adsentry.core.config.ResiliencyConfig;
import adsentry.core.model.lockout.LockoutStatus;
import adsentry.core.port.out.SecurityMetrics;
import adsentry.spi.AttemptCache;

/**
 * Redis implementation of AttemptCache.
 *
 * <p>This is the default implementation for production deployments.
 * Keys are used exactly as built by {@link adsentry.core.model.lockout.LockoutKeys}:
 * <ul>
 *   <li>Counters: string values updated with {@code INCR}, TTL set on creation</li>
 *   <li>Statuses: hashes with {@code locked}, {@code expiresAt}, {@code reason} and
 *       {@code failedAttempts}, expiring with the lockout</li>
 * </ul>
 *
 * <p>Reads and writes degrade silently since the store is authoritative.
 * Deletions report failures so callers can log missed invalidations.
 */
@ApplicationScoped
@DefaultBean
public class RedisAttemptCache implements AttemptCache {

    private static final Logger LOG = Logger.getLogger(RedisAttemptCache.class);

    private static final String FIELD_LOCKED = "locked";
    private static final String FIELD_EXPIRES_AT = "expiresAt";
    private static final String FIELD_REASON = "reason";
    private static final String FIELD_FAILED_ATTEMPTS = "failedAttempts";

    private static final int SCAN_COUNT = 1000;

    private final ReactiveValueCommands<String, Long> valueCommands;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final RedisTimeoutHelper timeoutHelper;

    @Inject
    public RedisAttemptCache(
            ReactiveRedisDataSource redisDataSource, ResiliencyConfig resiliencyConfig, SecurityMetrics metrics) {
        this.valueCommands = redisDataSource.value(String.class, Long.class);
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.timeoutHelper = new RedisTimeoutHelper(
                resiliencyConfig.redis().operationTimeout(), metrics, "RedisAttemptCache");
        LOG.info("Initialized Redis attempt cache");
    }

    @Override
    public Uni<Long> increment(String key, Duration window) {
        final var operation = valueCommands.incr(key).call(count -> count == 1L
                ? keyCommands.expire(key, window.toSeconds()).replaceWithVoid()
                : Uni.createFrom().voidItem());
        return timeoutHelper.orElse(operation, "increment", () -> 0L);
    }

    @Override
    public Uni<Optional<LockoutStatus>> getStatus(String key) {
        return timeoutHelper.orEmpty(hashCommands.hgetall(key).map(RedisAttemptCache::toStatus), "getStatus");
    }

    @Override
    public Uni<Void> putStatus(String key, LockoutStatus status, Duration ttl) {
        final var fields = Map.of(
                FIELD_LOCKED, String.valueOf(status.isLocked()),
                FIELD_EXPIRES_AT, status.lockoutExpiresAt() != null
                        ? String.valueOf(status.lockoutExpiresAt().toEpochMilli())
                        : "",
                FIELD_REASON, status.lockoutReason() != null ? status.lockoutReason() : "",
                FIELD_FAILED_ATTEMPTS, String.valueOf(status.failedAttempts()));

        final var operation = hashCommands
                .hset(key, fields)
                .call(() -> keyCommands.pexpire(key, ttl.toMillis()))
                .replaceWithVoid();
        return timeoutHelper.ignoreFailure(operation, "putStatus");
    }

    @Override
    public Uni<Void> delete(String key) {
        return timeoutHelper.propagate(keyCommands.del(key).replaceWithVoid(), "delete");
    }

    @Override
    public Uni<Long> deleteMatching(String pattern) {
        final var args = new KeyScanArgs().match(pattern).count(SCAN_COUNT);
        final var operation = keyCommands
                .scan(args)
                .toMulti()
                .collect()
                .asList()
                .chain(keys -> keys.isEmpty()
                        ? Uni.createFrom().item(0)
                        : keyCommands.del(keys.toArray(new String[0])))
                .map(Integer::longValue)
                .invoke(count -> LOG.debugf("Deleted %d keys matching %s", count, pattern));
        return timeoutHelper.propagate(operation, "deleteMatching");
    }

    static LockoutStatus toStatus(Map<String, String> fields) {
        if (fields == null || fields.isEmpty()) {
            return null;
        }
        try {
            final var expiresAt = fields.get(FIELD_EXPIRES_AT);
            final var reason = fields.get(FIELD_REASON);
            final var failedAttempts = fields.get(FIELD_FAILED_ATTEMPTS);
            return new LockoutStatus(
                    Boolean.parseBoolean(fields.get(FIELD_LOCKED)),
                    expiresAt == null || expiresAt.isEmpty() ? null : Instant.ofEpochMilli(Long.parseLong(expiresAt)),
                    reason == null || reason.isEmpty() ? null : reason,
                    failedAttempts != null ? Integer.parseInt(failedAttempts) : 0);
        } catch (NumberFormatException e) {
            LOG.warnv("Ignoring malformed cached lockout status: {0}", e.getMessage());
            return null;
        }
    }
}
