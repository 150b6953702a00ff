package adsentry.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for timeouts of the shared cache and store.
 *
 * <p>Configuration prefix: {@code adsentry.resiliency}
 */
@ConfigMapping(prefix = "adsentry.resiliency")
public interface ResiliencyConfig {

    /**
     * Redis timeout configuration.
     */
    RedisConfig redis();

    /**
     * PostgreSQL timeout configuration.
     */
    PostgresConfig postgres();

    /**
     * Redis timeout settings.
     */
    interface RedisConfig {

        /**
         * Maximum time to wait for a Redis operation to complete.
         *
         * <p>Behavior on timeout depends on the operation:
         * <ul>
         *   <li>Status reads: treated as a cache miss</li>
         *   <li>Counter increments: ignored, the store holds the real count</li>
         *   <li>Status writes: ignored, the status is re-derived on the next check</li>
         *   <li>Invalidations: reported to the caller, which logs them</li>
         * </ul>
         *
         * @return operation timeout (default: 1 second)
         */
        @WithDefault("PT1S")
        Duration operationTimeout();
    }

    /**
     * PostgreSQL timeout settings.
     */
    interface PostgresConfig {

        /**
         * Maximum time to wait for a query or transaction to complete.
         *
         * @return query timeout (default: 5 seconds)
         */
        @WithDefault("PT5S")
        Duration queryTimeout();
    }
}
