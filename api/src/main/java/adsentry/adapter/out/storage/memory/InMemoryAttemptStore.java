package adsentry.adapter.out.storage.memory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import adsentry.core.model.lockout.AccountLockout;
import adsentry.core.model.lockout.FailedLoginAttempt;
import adsentry.core.port.out.AttemptStore;

/**
 * In-memory implementation of AttemptStore.
 *
 * <p>
 * This implementation is intended for development and testing only.
 * History is lost on restart and not shared across instances.
 *
 * <p>
 * A single lock serializes every operation, which makes {@link #unlock} atomic
 * in the same way the relational store's transaction does.
 */
public class InMemoryAttemptStore implements AttemptStore {

    private static final Logger LOG = Logger.getLogger(InMemoryAttemptStore.class);

    private final List<FailedLoginAttempt> attempts = new ArrayList<>();
    private final List<AccountLockout> lockouts = new ArrayList<>();
    private final AtomicLong lockoutIds = new AtomicLong();
    private final ReentrantLock lock = new ReentrantLock();

    public InMemoryAttemptStore() {
        LOG.info("Initialized in-memory attempt store");
    }

    @Override
    public Uni<Void> saveAttempt(FailedLoginAttempt attempt) {
        return locked(() -> {
            attempts.add(attempt);
            return null;
        });
    }

    @Override
    public Uni<Integer> countAttemptsSince(String username, String ipAddress, Instant since) {
        return locked(() -> (int) attempts.stream()
                .filter(attempt -> matches(attempt, username, ipAddress, since))
                .count());
    }

    @Override
    public Uni<Integer> deleteAttemptsSince(String username, String ipAddress, Instant since) {
        return locked(() -> {
            final var before = attempts.size();
            attempts.removeIf(attempt -> matches(attempt, username, ipAddress, since));
            return before - attempts.size();
        });
    }

    @Override
    public Uni<Integer> countLockouts(String username) {
        return locked(() -> (int) lockouts.stream()
                .filter(lockout -> lockout.username().equals(username))
                .count());
    }

    @Override
    public Uni<AccountLockout> saveLockout(AccountLockout lockout) {
        return locked(() -> {
            final var saved = lockout.withId(lockoutIds.incrementAndGet());
            lockouts.add(saved);
            return saved;
        });
    }

    @Override
    public Uni<Optional<AccountLockout>> findActiveLockout(String username, String ipAddress, Instant now) {
        return locked(() -> lockouts.stream()
                .filter(lockout -> lockout.username().equals(username))
                .filter(lockout -> ipAddress == null
                        || lockout.ipAddress() == null
                        || lockout.ipAddress().equals(ipAddress))
                .filter(lockout -> lockout.isActiveAt(now))
                .max(Comparator.comparing(AccountLockout::expiresAt)));
    }

    @Override
    public Uni<Integer> unlock(String username, String unlockedBy, String reason, Instant now) {
        return locked(() -> {
            int released = 0;
            for (int i = 0; i < lockouts.size(); i++) {
                final var lockout = lockouts.get(i);
                if (lockout.username().equals(username) && lockout.isActiveAt(now)) {
                    lockouts.set(i, lockout.unlock(now, unlockedBy, reason));
                    released++;
                }
            }
            attempts.removeIf(attempt -> attempt.username().equals(username));
            return released;
        });
    }

    @Override
    public Uni<List<AccountLockout>> findLockoutHistory(String username, int limit) {
        return locked(() -> lockouts.stream()
                .filter(lockout -> lockout.username().equals(username))
                .sorted(Comparator.comparing(AccountLockout::lockedAt)
                        .thenComparing(AccountLockout::id)
                        .reversed())
                .limit(limit)
                .toList());
    }

    @Override
    public Uni<List<AccountLockout>> findActiveLockouts(Instant now, int limit) {
        return locked(() -> {
            final var newest = new LinkedHashMap<String, AccountLockout>();
            lockouts.stream()
                    .filter(lockout -> lockout.isActiveAt(now))
                    .sorted(Comparator.comparing(AccountLockout::username)
                            .thenComparing(AccountLockout::lockedAt, Comparator.reverseOrder()))
                    .forEach(lockout -> newest.putIfAbsent(lockout.username(), lockout));
            return newest.values().stream().limit(limit).toList();
        });
    }

    /**
     * Clear all entries (for testing).
     */
    public void clear() {
        lock.lock();
        try {
            attempts.clear();
            lockouts.clear();
        } finally {
            lock.unlock();
        }
    }

    private static boolean matches(FailedLoginAttempt attempt, String username, String ipAddress, Instant since) {
        return attempt.username().equals(username)
                && (ipAddress == null || Objects.equals(attempt.ipAddress(), ipAddress))
                && attempt.attemptedAt().isAfter(since);
    }

    private <T> Uni<T> locked(Supplier<T> operation) {
        return Uni.createFrom().item(() -> {
            lock.lock();
            try {
                return operation.get();
            } finally {
                lock.unlock();
            }
        });
    }
}
