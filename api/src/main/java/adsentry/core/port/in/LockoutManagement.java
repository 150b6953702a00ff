package adsentry.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import adsentry.core.model.lockout.AccountLockout;
import adsentry.core.model.lockout.FailedLoginAttempt;
import adsentry.core.model.lockout.LockoutStatus;

/**
 * Use case interface for failed-login tracking and account lockout.
 */
public interface LockoutManagement {

    int DEFAULT_HISTORY_LIMIT = 10;

    /**
     * Record a failed login and lock the account if the threshold is reached.
     *
     * @param attempt the failed attempt
     * @return Uni with the resulting status
     */
    Uni<LockoutStatus> recordFailedAttempt(FailedLoginAttempt attempt);

    /**
     * Current lockout status of an account.
     *
     * @param username  the username
     * @param ipAddress client address (may be null)
     * @return Uni with the status; never fails
     */
    Uni<LockoutStatus> checkLockoutStatus(String username, String ipAddress);

    /**
     * Forget recent failed attempts after a successful login.
     *
     * @param username  the username
     * @param ipAddress client address
     * @return Uni completing when done; never fails
     */
    Uni<Void> clearFailedAttempts(String username, String ipAddress);

    /**
     * Release an account's lockouts and clear its failed attempt history.
     *
     * @param username   the username
     * @param unlockedBy administrator performing the unlock
     * @param reason     unlock reason (may be null)
     * @return Uni with the number of lockouts released; fails if the store update failed
     */
    Uni<Integer> unlockAccount(String username, String unlockedBy, String reason);

    /**
     * Lockout history of an account, most recent first.
     *
     * @param username the username
     * @param limit    maximum entries
     * @return Uni with the history; empty on store failure
     */
    Uni<List<AccountLockout>> getLockoutHistory(String username, int limit);

    /**
     * Currently locked accounts.
     *
     * @param limit maximum entries
     * @return Uni with the newest active lockout per username
     */
    Uni<List<AccountLockout>> listActiveLockouts(int limit);

    default Uni<LockoutStatus> checkLockoutStatus(String username) {
        return checkLockoutStatus(username, null);
    }

    default Uni<List<AccountLockout>> getLockoutHistory(String username) {
        return getLockoutHistory(username, DEFAULT_HISTORY_LIMIT);
    }
}
