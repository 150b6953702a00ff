package adsentry.core.service.lockout;

import java.time.Duration;
import java.util.List;

/**
 * Chooses how long an account stays locked based on how often it was locked before.
 *
 * <p>The n-th lockout (0-based count of earlier lockouts) uses the n-th configured
 * duration, repeat offenders beyond the list use the last one, and every duration is
 * capped at the configured maximum.
 */
public final class ProgressiveLockoutPolicy {

    private final List<Duration> durations;
    private final Duration maxDuration;

    /**
     * @param durations   non-empty, non-decreasing list of positive durations
     * @param maxDuration ceiling applied to every duration
     * @throws IllegalArgumentException if the durations are empty, non-positive or decreasing
     */
    public ProgressiveLockoutPolicy(List<Duration> durations, Duration maxDuration) {
        if (durations == null || durations.isEmpty()) {
            throw new IllegalArgumentException("At least one lockout duration is required");
        }
        if (maxDuration == null || maxDuration.isNegative() || maxDuration.isZero()) {
            throw new IllegalArgumentException("Maximum lockout duration must be positive");
        }
        Duration previous = Duration.ZERO;
        for (final var duration : durations) {
            if (duration == null || duration.isNegative() || duration.isZero()) {
                throw new IllegalArgumentException("Lockout durations must be positive: " + durations);
            }
            if (duration.compareTo(previous) < 0) {
                throw new IllegalArgumentException("Lockout durations must be non-decreasing: " + durations);
            }
            previous = duration;
        }
        this.durations = List.copyOf(durations);
        this.maxDuration = maxDuration;
    }

    /**
     * Duration of the next lockout.
     *
     * @param previousLockouts lockouts the account already had
     * @return the lockout duration
     */
    public Duration durationFor(int previousLockouts) {
        final var index = Math.min(Math.max(0, previousLockouts), durations.size() - 1);
        return clamp(durations.get(index));
    }

    /**
     * Duration of a first lockout, used when the history cannot be read.
     */
    public Duration firstDuration() {
        return clamp(durations.get(0));
    }

    private Duration clamp(Duration duration) {
        return duration.compareTo(maxDuration) > 0 ? maxDuration : duration;
    }
}
