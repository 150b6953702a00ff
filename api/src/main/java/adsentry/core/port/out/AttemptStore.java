package adsentry.core.port.out;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import adsentry.core.model.lockout.AccountLockout;
import adsentry.core.model.lockout.FailedLoginAttempt;

/**
 * Port interface for the durable history of failed logins and lockouts.
 *
 * <p>This store is the source of truth for every lockout decision. The cache
 * only accelerates reads of it.
 *
 * <p>Operations that take an optional {@code ipAddress} match every address
 * when it is null.
 */
public interface AttemptStore {

    /**
     * Persist a failed attempt.
     *
     * @param attempt the attempt
     * @return Uni completing when stored
     */
    Uni<Void> saveAttempt(FailedLoginAttempt attempt);

    /**
     * Count failed attempts newer than {@code since}.
     *
     * @param username  the username
     * @param ipAddress client address, or null for all addresses
     * @param since     start of the counting window
     * @return Uni with the count
     */
    Uni<Integer> countAttemptsSince(String username, String ipAddress, Instant since);

    /**
     * Delete failed attempts newer than {@code since}.
     *
     * @param username  the username
     * @param ipAddress client address, or null for all addresses
     * @param since     start of the window to clear
     * @return Uni with the number of attempts deleted
     */
    Uni<Integer> deleteAttemptsSince(String username, String ipAddress, Instant since);

    /**
     * Count every lockout the username has ever had.
     *
     * @param username the username
     * @return Uni with the lifetime lockout count
     */
    Uni<Integer> countLockouts(String username);

    /**
     * Persist a new lockout.
     *
     * @param lockout the lockout to insert
     * @return Uni with the stored lockout, carrying its assigned id
     */
    Uni<AccountLockout> saveLockout(AccountLockout lockout);

    /**
     * Find the active lockout with the latest expiry.
     *
     * <p>A lockout recorded without an address applies to every address.
     *
     * @param username  the username
     * @param ipAddress client address, or null for all addresses
     * @param now       reference time for expiry
     * @return Uni with the lockout, or empty if none is active
     */
    Uni<Optional<AccountLockout>> findActiveLockout(String username, String ipAddress, Instant now);

    /**
     * Release the user's active lockouts and delete the user's entire failed
     * attempt history, atomically.
     *
     * <p>Either both changes are applied or neither is.
     *
     * @param username   the username
     * @param unlockedBy administrator performing the unlock
     * @param reason     unlock reason
     * @param now        unlock time
     * @return Uni with the number of lockouts released
     */
    Uni<Integer> unlock(String username, String unlockedBy, String reason, Instant now);

    /**
     * Lockouts of a user, most recent first.
     *
     * @param username the username
     * @param limit    maximum rows
     * @return Uni with the history
     */
    Uni<List<AccountLockout>> findLockoutHistory(String username, int limit);

    /**
     * The newest active lockout of each locked username.
     *
     * @param now   reference time for expiry
     * @param limit maximum rows
     * @return Uni with active lockouts ordered by username
     */
    Uni<List<AccountLockout>> findActiveLockouts(Instant now, int limit);

    /**
     * Convenience for the common windowed count.
     */
    default Uni<Integer> countRecentAttempts(String username, String ipAddress, Duration window) {
        return countAttemptsSince(username, ipAddress, Instant.now().minus(window));
    }
}
