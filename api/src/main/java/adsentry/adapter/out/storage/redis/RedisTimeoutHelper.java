package adsentry.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import adsentry.core.port.out.SecurityMetrics;

/**
 * Applies the cache operation timeout and a failure policy to Redis calls.
 *
 * <h2>Policies</h2>
 * <ul>
 *   <li>{@link #propagate} - timeouts become {@link RedisTimeoutException}, other
 *       failures pass through unchanged. For invalidations the caller must hear about.</li>
 *   <li>{@link #orEmpty} - timeouts and failures become an empty Optional. For reads
 *       where a miss is acceptable.</li>
 *   <li>{@link #orElse} - timeouts and failures become a fallback value.</li>
 *   <li>{@link #ignoreFailure} - timeouts and failures are logged and dropped. For
 *       writes of data that can be recomputed.</li>
 * </ul>
 *
 * <p>Timeouts and other failures are counted separately through
 * {@link SecurityMetrics#recordCacheFailure}.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final SecurityMetrics metrics;
    private final String cacheName;

    /**
     * @param timeout   maximum time for one Redis operation
     * @param metrics   metrics port (may be null)
     * @param cacheName name used in log messages
     */
    public RedisTimeoutHelper(Duration timeout, SecurityMetrics metrics, String cacheName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.cacheName = cacheName;
    }

    /**
     * Fail with {@link RedisTimeoutException} on timeout; propagate other failures.
     */
    public <T> Uni<T> propagate(Uni<T> operation, String operationName) {
        return operation.ifNoItem().after(timeout).failWith(() -> {
            onTimeout(operationName, "failing");
            return new RedisTimeoutException(operationName, cacheName);
        });
    }

    /**
     * Resolve to an empty Optional on timeout or failure; a null item is also empty.
     */
    public <T> Uni<Optional<T>> orEmpty(Uni<T> operation, String operationName) {
        return orElse(operation.map(Optional::ofNullable), operationName, Optional::empty);
    }

    /**
     * Resolve to {@code fallback} on timeout or failure.
     */
    public <T> Uni<T> orElse(Uni<T> operation, String operationName, Supplier<T> fallback) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    onTimeout(operationName, "using fallback");
                    return fallback.get();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    onFailure(operationName, "using fallback", error);
                    return fallback.get();
                });
    }

    /**
     * Complete normally on timeout or failure.
     */
    public Uni<Void> ignoreFailure(Uni<Void> operation, String operationName) {
        return orElse(operation, operationName, () -> null);
    }

    private void onTimeout(String operationName, String outcome) {
        LOG.warnv("Redis {0} in {1} timed out after {2}, {3}", operationName, cacheName, timeout, outcome);
        if (metrics != null) {
            metrics.recordCacheFailure(operationName, true);
        }
    }

    private void onFailure(String operationName, String outcome, Throwable error) {
        LOG.warnv("Redis {0} in {1} failed, {2}: {3}", operationName, cacheName, outcome, error.getMessage());
        if (metrics != null) {
            metrics.recordCacheFailure(operationName, false);
        }
    }

    /**
     * A Redis operation exceeded the configured timeout.
     */
    public static class RedisTimeoutException extends RuntimeException {

        private final String operation;

        public RedisTimeoutException(String operation, String cacheName) {
            super("Redis operation timeout: " + operation + " in " + cacheName);
            this.operation = operation;
        }

        /** Returns the name of the operation that timed out. */
        public String getOperation() {
            return operation;
        }
    }
}
