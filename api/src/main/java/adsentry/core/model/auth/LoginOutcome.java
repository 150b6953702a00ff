package adsentry.core.model.auth;

import java.time.Duration;
import java.time.Instant;

import adsentry.core.model.directory.DirectoryEntry;
import adsentry.core.model.lockout.LockoutStatus;
import adsentry.core.model.lockout.LoginErrorType;

/**
 * Result of a directory login.
 *
 * <ul>
 *   <li>{@link Authenticated} - credentials accepted and the account is usable</li>
 *   <li>{@link Locked} - refused without checking credentials</li>
 *   <li>{@link Failed} - refused after checking credentials; the attempt was recorded</li>
 * </ul>
 */
public sealed interface LoginOutcome {

    /**
     * Credentials accepted.
     *
     * @param user directory entry of the authenticated user
     */
    record Authenticated(DirectoryEntry user) implements LoginOutcome {}

    /**
     * The account was already locked.
     *
     * @param status the lockout status
     */
    record Locked(LockoutStatus status) implements LoginOutcome {

        /** Time until the lockout ends. */
        public Duration retryAfter() {
            return status.remaining(Instant.now());
        }
    }

    /**
     * The login failed.
     *
     * @param errorType why it failed
     * @param status    lockout status after recording the attempt; locked if this attempt
     *                  reached the threshold
     */
    record Failed(LoginErrorType errorType, LockoutStatus status) implements LoginOutcome {}
}
