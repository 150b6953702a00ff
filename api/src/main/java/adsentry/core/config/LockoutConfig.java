package adsentry.core.config;

import java.time.Duration;
import java.util.List;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for failed-login tracking and account lockout.
 *
 * <p>Configuration prefix: {@code adsentry.lockout}
 *
 * <p>Failed attempts are counted per username and client address over a sliding
 * window. Reaching the threshold locks the account for a duration that grows
 * with the number of earlier lockouts of the same username.
 *
 * @see adsentry.core.service.lockout.LockoutEngine
 */
@ConfigMapping(prefix = "adsentry.lockout")
public interface LockoutConfig {

    /**
     * Enable lockout enforcement.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Failed attempts within the window that lock the account.
     *
     * @return max attempts (default: 5)
     */
    @WithDefault("5")
    int maxFailedAttempts();

    /**
     * Sliding window over which failed attempts are counted.
     *
     * @return window duration (default: 15 minutes)
     */
    @WithDefault("PT15M")
    Duration attemptWindow();

    /**
     * Lockout duration by offense: the first entry applies to a first lockout,
     * the second to a second one, and the last entry to every later one.
     *
     * <p>Must be non-decreasing.
     *
     * <p>Example with the defaults:
     * <ul>
     *   <li>First lockout: 15 minutes</li>
     *   <li>Second lockout: 30 minutes</li>
     *   <li>Third and later lockouts: 60 minutes</li>
     * </ul>
     *
     * @return durations (default: 15, 30 and 60 minutes)
     */
    @WithDefault("PT15M,PT30M,PT1H")
    List<Duration> lockoutDurations();

    /**
     * Ceiling for any lockout duration.
     *
     * @return max duration (default: 60 minutes)
     */
    @WithDefault("PT1H")
    Duration maxLockoutDuration();

    /**
     * Relational store settings.
     */
    StoreConfig store();

    interface StoreConfig {

        /**
         * Create the lockout tables on startup if they do not exist.
         *
         * @return true to apply the schema script (default: false)
         */
        @WithDefault("false")
        boolean initializeSchema();
    }
}
