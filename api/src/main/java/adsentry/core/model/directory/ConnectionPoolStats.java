package adsentry.core.model.directory;

/**
 * Snapshot of the directory connection pool.
 *
 * @param idleConnections connections currently idle in the pool
 * @param maxConnections  maximum idle connections
 */
public record ConnectionPoolStats(int idleConnections, int maxConnections) {

    public static ConnectionPoolStats none() {
        return new ConnectionPoolStats(0, 0);
    }
}
