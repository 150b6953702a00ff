package adsentry.core.port.out;

/**
 * Port interface for recording authentication security metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface SecurityMetrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a directory authentication result.
     *
     * @param success whether the bind succeeded
     */
    void recordAuthentication(boolean success);

    /**
     * Record a failed login attempt.
     *
     * @param errorType the stored error type value
     */
    void recordFailedAttempt(String errorType);

    /**
     * Record a lockout.
     *
     * @param durationMinutes chosen lockout duration
     */
    void recordLockout(long durationMinutes);

    /**
     * Record a manual unlock.
     *
     * @param released number of lockouts released
     */
    void recordUnlock(int released);

    /**
     * Record a connection pool event.
     *
     * @param event one of {@code created}, {@code reused}, {@code discarded}, {@code flushed}
     */
    void recordPoolEvent(String event);

    /**
     * Record a cache operation failure.
     *
     * @param operation the cache operation name
     * @param timeout   true if the operation timed out rather than failed
     */
    void recordCacheFailure(String operation, boolean timeout);
}
