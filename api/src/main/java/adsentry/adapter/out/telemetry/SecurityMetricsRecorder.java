package adsentry.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;

import adsentry.core.port.out.SecurityMetrics;

/**
 * Records authentication security metrics using Micrometer.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code adsentry.auth.attempts.total} - Directory binds by result</li>
 *   <li>{@code adsentry.lockout.failed.attempts.total} - Failed logins by error type</li>
 *   <li>{@code adsentry.lockout.lockouts.total} - Lockouts triggered</li>
 *   <li>{@code adsentry.lockout.duration.minutes} - Distribution of lockout durations</li>
 *   <li>{@code adsentry.lockout.unlocks.total} - Lockouts released by administrators</li>
 *   <li>{@code adsentry.directory.pool.events.total} - Pool events (created, reused, discarded, flushed)</li>
 *   <li>{@code adsentry.cache.failures.total} - Attempt cache timeouts and failures by operation</li>
 * </ul>
 */
@ApplicationScoped
public class SecurityMetricsRecorder implements SecurityMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public SecurityMetricsRecorder(MeterRegistry registry) {
        this.registry = registry;
        this.enabled = registry != null;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordAuthentication(boolean success) {
        if (!enabled) {
            return;
        }

        Counter.builder("adsentry.auth.attempts.total")
                .description("Directory authentication attempts")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    @Override
    public void recordFailedAttempt(String errorType) {
        if (!enabled) {
            return;
        }

        Counter.builder("adsentry.lockout.failed.attempts.total")
                .description("Failed login attempts recorded for lockout tracking")
                .tag("error_type", nullSafe(errorType))
                .register(registry)
                .increment();
    }

    @Override
    public void recordLockout(long durationMinutes) {
        if (!enabled) {
            return;
        }

        Counter.builder("adsentry.lockout.lockouts.total")
                .description("Accounts locked after repeated failed logins")
                .register(registry)
                .increment();

        DistributionSummary.builder("adsentry.lockout.duration.minutes")
                .description("Duration of triggered lockouts")
                .baseUnit("minutes")
                .register(registry)
                .record(durationMinutes);
    }

    @Override
    public void recordUnlock(int released) {
        if (!enabled) {
            return;
        }

        Counter.builder("adsentry.lockout.unlocks.total")
                .description("Lockouts released by administrators")
                .register(registry)
                .increment(released);
    }

    @Override
    public void recordPoolEvent(String event) {
        if (!enabled) {
            return;
        }

        Counter.builder("adsentry.directory.pool.events.total")
                .description("Directory connection pool events")
                .tag("event", nullSafe(event))
                .register(registry)
                .increment();
    }

    @Override
    public void recordCacheFailure(String operation, boolean timeout) {
        if (!enabled) {
            return;
        }

        Counter.builder("adsentry.cache.failures.total")
                .description("Attempt cache operations that timed out or failed")
                .tag("operation", nullSafe(operation))
                .tag("kind", timeout ? "timeout" : "failure")
                .register(registry)
                .increment();
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
