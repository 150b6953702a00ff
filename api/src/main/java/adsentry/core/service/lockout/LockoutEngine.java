package adsentry.core.service.lockout;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import adsentry.core.config.LockoutConfig;
import adsentry.core.model.lockout.AccountLockout;
import adsentry.core.model.lockout.FailedLoginAttempt;
import adsentry.core.model.lockout.LockoutKeys;
import adsentry.core.model.lockout.LockoutStatus;
import adsentry.core.port.in.LockoutManagement;
import adsentry.core.port.out.AttemptStore;
import adsentry.core.port.out.SecurityMetrics;
import adsentry.spi.AttemptCache;

/**
 * Failed-login tracking with progressive account lockout (brute force protection).
 *
 * <p>Protects the directory login path against:
 * <ul>
 * <li>Password guessing against a single account</li>
 * <li>Credential stuffing from a single client</li>
 * </ul>
 *
 * <p>Failed attempts are counted per username and client address over a sliding
 * window. The {@link AttemptStore} is authoritative for every decision; the
 * {@link AttemptCache} holds attempt counters and recently computed lockout
 * statuses only as hints, so a cache outage never changes the outcome.
 *
 * <p>Error policy:
 * <ul>
 * <li>Recording degrades: a lost write never blocks the login path</li>
 * <li>Status checks fail open: a store outage reports the account as unlocked</li>
 * <li>Unlocks fail loudly: the caller learns when the store rejected them</li>
 * </ul>
 */
@ApplicationScoped
public class LockoutEngine implements LockoutManagement {

    private static final Logger LOG = Logger.getLogger(LockoutEngine.class);

    static final String DEFAULT_UNLOCK_REASON = "Manual unlock by administrator";

    private final LockoutConfig config;
    private final AttemptStore store;
    private final AttemptCache cache;
    private final SecurityMetrics metrics;
    private final ProgressiveLockoutPolicy policy;

    @Inject
    public LockoutEngine(LockoutConfig config, AttemptStore store, AttemptCache cache, SecurityMetrics metrics) {
        this.config = config;
        this.store = store;
        this.cache = cache;
        this.metrics = metrics;
        this.policy = new ProgressiveLockoutPolicy(config.lockoutDurations(), config.maxLockoutDuration());
    }

    @Override
    public Uni<LockoutStatus> recordFailedAttempt(FailedLoginAttempt attempt) {
        if (!config.enabled()) {
            return Uni.createFrom().item(LockoutStatus.unlocked(0));
        }

        final var username = attempt.username();
        final var ip = attempt.ipAddress();
        LOG.debugf(
                "Recording failed login: username=%s, ip=%s, errorType=%s",
                username, ip, attempt.errorType().value());
        metrics.recordFailedAttempt(attempt.errorType().value());

        return persistAttempt(attempt)
                .call(() -> incrementCounter(username, ip))
                .chain(() -> windowedCount(username, ip))
                .chain(count -> {
                    if (count.isEmpty()) {
                        return Uni.createFrom().item(LockoutStatus.unlocked(0));
                    }
                    final int attempts = count.get();
                    if (attempts >= config.maxFailedAttempts()) {
                        return lockAccount(username, ip, attempts);
                    }
                    LOG.debugf(
                            "Failed attempt recorded for %s: count=%d, remaining=%d",
                            username, attempts, config.maxFailedAttempts() - attempts);
                    return Uni.createFrom().item(LockoutStatus.unlocked(attempts));
                });
    }

    private Uni<Void> persistAttempt(FailedLoginAttempt attempt) {
        return store.saveAttempt(attempt).onFailure().recoverWithItem(error -> {
            LOG.warnv(error, "Failed to persist failed login for {0}", attempt.username());
            return null;
        });
    }

    private Uni<Long> incrementCounter(String username, String ip) {
        return cache.increment(LockoutKeys.failedAttempts(username, ip), config.attemptWindow())
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.debugv("Attempt counter not updated for {0}: {1}", username, error.getMessage());
                    return 0L;
                });
    }

    private Uni<Optional<Integer>> windowedCount(String username, String ip) {
        return store.countRecentAttempts(username, ip, config.attemptWindow())
                .map(Optional::of)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.errorv(error, "Failed to count recent failed logins for {0}", username);
                    return Optional.empty();
                });
    }

    private Uni<LockoutStatus> lockAccount(String username, String ip, int attempts) {
        final var now = Instant.now();
        return store.countLockouts(username)
                .map(policy::durationFor)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Lockout history unavailable for {0}, using first duration: {1}",
                            username, error.getMessage());
                    return policy.firstDuration();
                })
                .chain(duration -> {
                    final var reason = lockoutReason(attempts);
                    final var lockout = AccountLockout.start(username, ip, reason, attempts, duration, now);
                    final var status = LockoutStatus.locked(lockout.expiresAt(), reason, attempts);
                    return store.saveLockout(lockout)
                            .invoke(saved -> {
                                LOG.warnf(
                                        "Account locked: username=%s, ip=%s, attempts=%d, duration=%s",
                                        username, ip, attempts, duration);
                                metrics.recordLockout(duration.toMinutes());
                            })
                            .onFailure()
                            .recoverWithItem(error -> {
                                LOG.errorv(error, "Failed to persist lockout for {0}", username);
                                return lockout;
                            })
                            .call(() -> cacheStatus(LockoutKeys.lockout(username, ip), status, now))
                            .replaceWith(status);
                });
    }

    private String lockoutReason(int attempts) {
        return String.format(
                "Account locked due to %d failed login attempts in %d minutes",
                attempts, config.attemptWindow().toMinutes());
    }

    @Override
    public Uni<LockoutStatus> checkLockoutStatus(String username, String ipAddress) {
        if (!config.enabled()) {
            return Uni.createFrom().item(LockoutStatus.unlocked(0));
        }

        final var now = Instant.now();
        final var hasIp = ipAddress != null && !ipAddress.isEmpty();

        // Address-specific status first, then the username-wide one
        final Uni<Optional<LockoutStatus>> cached = hasIp
                ? cachedStatus(LockoutKeys.lockout(username, ipAddress), now)
                        .chain(hit -> hit.isPresent()
                                ? Uni.createFrom().item(hit)
                                : cachedStatus(LockoutKeys.lockout(username), now))
                : cachedStatus(LockoutKeys.lockout(username), now);

        return cached.chain(hit -> {
                    if (hit.isPresent()) {
                        LOG.debugf("Lockout status for %s served from cache", username);
                        return Uni.createFrom().item(hit.get());
                    }
                    return statusFromStore(username, ipAddress, now);
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.errorv(error, "Lockout status unavailable for {0}, allowing login", username);
                    return LockoutStatus.unlocked(0);
                });
    }

    private Uni<Optional<LockoutStatus>> cachedStatus(String key, Instant now) {
        return cache.getStatus(key)
                .map(status -> status.filter(s -> s.isCurrent(now)))
                .onFailure()
                .recoverWithItem(Optional.empty());
    }

    private Uni<LockoutStatus> statusFromStore(String username, String ipAddress, Instant now) {
        return store.findActiveLockout(username, ipAddress, now).chain(active -> {
            if (active.isPresent()) {
                final var lockout = active.get();
                final var status =
                        LockoutStatus.locked(lockout.expiresAt(), lockout.reason(), lockout.failedAttempts());
                return cacheStatus(LockoutKeys.lockout(username, ipAddress), status, now)
                        .replaceWith(status);
            }
            return store.countRecentAttempts(username, ipAddress, config.attemptWindow())
                    .map(LockoutStatus::unlocked);
        });
    }

    private Uni<Void> cacheStatus(String key, LockoutStatus status, Instant now) {
        final var ttl = status.remaining(now);
        if (ttl.isZero()) {
            return Uni.createFrom().voidItem();
        }
        return cache.putStatus(key, status, ttl).onFailure().recoverWithItem(error -> {
            LOG.debugv("Lockout status not cached for {0}: {1}", key, error.getMessage());
            return null;
        });
    }

    @Override
    public Uni<Void> clearFailedAttempts(String username, String ipAddress) {
        if (!config.enabled()) {
            return Uni.createFrom().voidItem();
        }

        final var since = Instant.now().minus(config.attemptWindow());
        LOG.debugf("Clearing failed logins: username=%s, ip=%s", username, ipAddress);

        var clear = store.deleteAttemptsSince(username, ipAddress, since)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(error, "Failed to delete recent failed logins for {0}", username);
                    return 0;
                })
                .replaceWithVoid()
                .call(() -> invalidate(LockoutKeys.failedAttempts(username, ipAddress)))
                .call(() -> invalidateMatching(LockoutKeys.failedAttemptsOfUser(username)));
        if (ipAddress != null && !ipAddress.isEmpty()) {
            clear = clear.call(() -> invalidateMatching(LockoutKeys.failedAttemptsFromIp(ipAddress)));
        }
        return clear;
    }

    @Override
    public Uni<Integer> unlockAccount(String username, String unlockedBy, String reason) {
        if (username == null || username.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Username cannot be null or blank"));
        }

        final var unlockReason = reason != null && !reason.isBlank() ? reason : DEFAULT_UNLOCK_REASON;
        return store.unlock(username, unlockedBy, unlockReason, Instant.now())
                .invoke(released -> {
                    LOG.infof(
                            "Account unlocked: username=%s, by=%s, released=%d, reason=%s",
                            username, unlockedBy, released, unlockReason);
                    metrics.recordUnlock(released);
                })
                .call(() -> invalidate(LockoutKeys.lockout(username)))
                .call(() -> invalidateMatching(LockoutKeys.lockoutsOfUser(username)))
                .call(() -> invalidateMatching(LockoutKeys.failedAttemptsOfUser(username)));
    }

    private Uni<Void> invalidate(String key) {
        return cache.delete(key).onFailure().recoverWithItem(error -> {
            LOG.warnv("Failed to invalidate cache key {0}: {1}", key, error.getMessage());
            return null;
        });
    }

    private Uni<Long> invalidateMatching(String pattern) {
        return cache.deleteMatching(pattern).onFailure().recoverWithItem(error -> {
            LOG.warnv("Failed to invalidate cache keys {0}: {1}", pattern, error.getMessage());
            return 0L;
        });
    }

    @Override
    public Uni<List<AccountLockout>> getLockoutHistory(String username, int limit) {
        final var effectiveLimit = limit > 0 ? limit : DEFAULT_HISTORY_LIMIT;
        return store.findLockoutHistory(username, effectiveLimit).onFailure().recoverWithItem(error -> {
            LOG.errorv(error, "Failed to load lockout history for {0}", username);
            return List.of();
        });
    }

    @Override
    public Uni<List<AccountLockout>> listActiveLockouts(int limit) {
        final var effectiveLimit = limit > 0 ? limit : 100;
        return store.findActiveLockouts(Instant.now(), effectiveLimit);
    }
}
