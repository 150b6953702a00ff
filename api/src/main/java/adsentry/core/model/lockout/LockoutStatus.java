package adsentry.core.model.lockout;

import java.time.Duration;
import java.time.Instant;

/**
 * Lockout state of an account as seen by the login path.
 *
 * @param isLocked         true if logins must be refused
 * @param lockoutExpiresAt when the lockout ends (null if not locked)
 * @param lockoutReason    reason shown to the user (null if not locked)
 * @param failedAttempts   failed attempts in the current window
 */
public record LockoutStatus(boolean isLocked, Instant lockoutExpiresAt, String lockoutReason, int failedAttempts) {

    public static LockoutStatus unlocked(int failedAttempts) {
        return new LockoutStatus(false, null, null, Math.max(0, failedAttempts));
    }

    public static LockoutStatus locked(Instant expiresAt, String reason, int failedAttempts) {
        return new LockoutStatus(true, expiresAt, reason, failedAttempts);
    }

    /**
     * Time left until the lockout ends, zero when unlocked, expired or without expiry.
     */
    public Duration remaining(Instant now) {
        if (!isLocked || lockoutExpiresAt == null || !now.isBefore(lockoutExpiresAt)) {
            return Duration.ZERO;
        }
        return Duration.between(now, lockoutExpiresAt);
    }

    /**
     * Whether this status still describes an unexpired lockout.
     */
    public boolean isCurrent(Instant now) {
        return isLocked && lockoutExpiresAt != null && now.isBefore(lockoutExpiresAt);
    }
}
