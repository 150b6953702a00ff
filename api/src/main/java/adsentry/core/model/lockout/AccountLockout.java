package adsentry.core.model.lockout;

import java.time.Duration;
import java.time.Instant;

/**
 * One lockout episode of an account.
 *
 * <p>A lockout is active while {@code now < expiresAt} and it has not been
 * unlocked. Expired lockouts are kept as history; they are never deleted here.
 *
 * @param id                     store-assigned identifier (0 before insertion)
 * @param username               locked account
 * @param ipAddress              client address the attempts came from (may be null)
 * @param reason                 human-readable lockout reason
 * @param failedAttempts         failed attempts that triggered the lockout
 * @param lockoutDurationMinutes chosen lockout duration
 * @param lockedAt               when the lockout started
 * @param expiresAt              when the lockout ends on its own
 * @param unlockedAt             when an administrator released it (may be null)
 * @param unlockedBy             administrator who released it (may be null)
 * @param unlockReason           why it was released (may be null)
 */
public record AccountLockout(
        long id,
        String username,
        String ipAddress,
        String reason,
        int failedAttempts,
        int lockoutDurationMinutes,
        Instant lockedAt,
        Instant expiresAt,
        Instant unlockedAt,
        String unlockedBy,
        String unlockReason) {

    public AccountLockout {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be null or blank");
        }
        if (lockedAt == null || expiresAt == null) {
            throw new IllegalArgumentException("Lockout timestamps cannot be null");
        }
    }

    /**
     * A new, not yet persisted lockout starting at {@code lockedAt}.
     */
    public static AccountLockout start(
            String username, String ipAddress, String reason, int failedAttempts, Duration duration, Instant lockedAt) {
        return new AccountLockout(
                0L,
                username,
                ipAddress,
                reason,
                failedAttempts,
                (int) duration.toMinutes(),
                lockedAt,
                lockedAt.plus(duration),
                null,
                null,
                null);
    }

    public boolean isActiveAt(Instant now) {
        return unlockedAt == null && now.isBefore(expiresAt);
    }

    public AccountLockout withId(long newId) {
        return new AccountLockout(
                newId,
                username,
                ipAddress,
                reason,
                failedAttempts,
                lockoutDurationMinutes,
                lockedAt,
                expiresAt,
                unlockedAt,
                unlockedBy,
                unlockReason);
    }

    public AccountLockout unlock(Instant at, String by, String why) {
        return new AccountLockout(
                id,
                username,
                ipAddress,
                reason,
                failedAttempts,
                lockoutDurationMinutes,
                lockedAt,
                expiresAt,
                at,
                by,
                why);
    }
}
