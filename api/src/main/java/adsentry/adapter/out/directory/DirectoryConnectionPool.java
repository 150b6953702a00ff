package adsentry.adapter.out.directory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import org.jboss.logging.Logger;

import adsentry.core.model.directory.DirectoryEntry;
import adsentry.core.model.directory.DirectoryError;
import adsentry.core.model.directory.DirectoryException;
import adsentry.core.model.directory.DirectorySearchRequest;
import adsentry.core.port.out.SecurityMetrics;

/**
 * Bounded set of idle service account connections.
 *
 * <p>Connections are health checked when taken out of the pool and created on
 * demand when none is idle, so the pool never blocks or queues a caller. At most
 * {@code maxConnections} connections are kept idle; extra ones are closed when
 * released.
 *
 * <p>The lock guards only the idle deque. Health checks, binds and closes run
 * outside it.
 *
 * <p>When the server rejects the service credentials during a health check or a
 * search, every idle connection is closed, since they were all bound with the
 * same credentials.
 */
public class DirectoryConnectionPool implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(DirectoryConnectionPool.class);

    static final Duration HEALTH_CHECK_TIME_LIMIT = Duration.ofSeconds(5);

    private final DirectoryConnectionFactory factory;
    private final String baseDn;
    private final int maxConnections;
    private final int maxRetries;
    private final int defaultSizeLimit;
    private final Duration defaultTimeLimit;
    private final SecurityMetrics metrics;

    private final Deque<DirectoryConnection> idle = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private volatile boolean closed;

    /**
     * @param factory          opens service account connections
     * @param baseDn           search base, also read by health checks
     * @param maxConnections   maximum idle connections
     * @param maxRetries       retries of a search whose session turned out unbound
     * @param defaultSizeLimit size limit for searches that set none
     * @param defaultTimeLimit time limit for searches that set none
     * @param metrics          pool event metrics (may be null)
     */
    public DirectoryConnectionPool(
            DirectoryConnectionFactory factory,
            String baseDn,
            int maxConnections,
            int maxRetries,
            int defaultSizeLimit,
            Duration defaultTimeLimit,
            SecurityMetrics metrics) {
        if (maxConnections < 1) {
            throw new IllegalArgumentException("Pool must allow at least one connection");
        }
        this.factory = factory;
        this.baseDn = baseDn;
        this.maxConnections = maxConnections;
        this.maxRetries = Math.max(0, maxRetries);
        this.defaultSizeLimit = defaultSizeLimit;
        this.defaultTimeLimit = defaultTimeLimit;
        this.metrics = metrics;
    }

    /**
     * Take a healthy connection, reusing an idle one when possible.
     *
     * @return a connection owned by the caller until {@link #release} or {@link #discard}
     * @throws DirectoryException if a new connection could not be opened and bound
     */
    public DirectoryConnection acquire() {
        if (closed) {
            throw new IllegalStateException("Directory connection pool is closed");
        }

        DirectoryConnection candidate;
        while ((candidate = poll()) != null) {
            try {
                candidate.checkHealth(baseDn, HEALTH_CHECK_TIME_LIMIT);
                recordEvent("reused");
                return candidate;
            } catch (DirectoryException e) {
                discard(candidate);
                if (e.isInvalidCredentials()) {
                    LOG.warn("Directory rejected the service credentials during a health check, flushing pool");
                    flush();
                    break;
                }
                LOG.debugv("Discarded unhealthy directory connection: {0}", e.getMessage());
            }
        }

        final var connection = factory.openServiceConnection();
        recordEvent("created");
        LOG.debugf("Opened directory connection %s", connection);
        return connection;
    }

    /**
     * Return a connection. It is kept idle when there is room, closed otherwise.
     * Releasing a connection that is already idle has no effect.
     */
    public void release(DirectoryConnection connection) {
        if (connection == null) {
            return;
        }

        boolean keep = false;
        lock.lock();
        try {
            if (containsIdle(connection)) {
                LOG.debugf("Ignoring second release of %s", connection);
                return;
            }
            if (!closed && idle.size() < maxConnections) {
                idle.push(connection);
                keep = true;
            }
        } finally {
            lock.unlock();
        }

        if (!keep) {
            connection.close();
            recordEvent("discarded");
        }
    }

    /**
     * Close a connection that must not be reused.
     */
    public void discard(DirectoryConnection connection) {
        if (connection != null) {
            connection.close();
            recordEvent("discarded");
        }
    }

    /**
     * Run a search with a pooled connection.
     *
     * <p>A search on a connection whose session was unbound is retried with a
     * fresh connection up to {@code maxRetries} times. Other errors are not
     * retried; the connection is closed if the failure concerns the session,
     * returned to the pool otherwise.
     *
     * @throws DirectoryException if the search failed
     */
    public List<DirectoryEntry> search(DirectorySearchRequest request) {
        final var effective = withDefaults(request);
        int retries = 0;
        while (true) {
            final var connection = acquire();
            try {
                final var entries = connection.search(baseDn, effective);
                release(connection);
                return entries;
            } catch (DirectoryException e) {
                if (e.isSessionUnbound() && retries < maxRetries) {
                    retries++;
                    discard(connection);
                    LOG.debugf("Directory session was unbound, retrying search (%d/%d)", retries, maxRetries);
                    continue;
                }
                if (e.isInvalidCredentials()) {
                    discard(connection);
                    flush();
                } else if (e.isSessionUnbound() || e.error() == DirectoryError.NETWORK) {
                    discard(connection);
                } else {
                    release(connection);
                }
                throw e;
            } catch (RuntimeException e) {
                discard(connection);
                throw e;
            }
        }
    }

    /**
     * Close every idle connection.
     */
    public void flush() {
        final List<DirectoryConnection> drained;
        lock.lock();
        try {
            drained = new ArrayList<>(idle);
            idle.clear();
        } finally {
            lock.unlock();
        }
        drained.forEach(DirectoryConnection::close);
        if (!drained.isEmpty()) {
            recordEvent("flushed");
            LOG.infof("Flushed %d idle directory connections", drained.size());
        }
    }

    /**
     * Flush the pool and refuse further acquisitions.
     */
    @Override
    public void close() {
        closed = true;
        flush();
    }

    public int idleCount() {
        lock.lock();
        try {
            return idle.size();
        } finally {
            lock.unlock();
        }
    }

    public int maxConnections() {
        return maxConnections;
    }

    public boolean isClosed() {
        return closed;
    }

    private DirectoryConnection poll() {
        lock.lock();
        try {
            return idle.poll();
        } finally {
            lock.unlock();
        }
    }

    private boolean containsIdle(DirectoryConnection connection) {
        for (final var pooled : idle) {
            if (pooled == connection) {
                return true;
            }
        }
        return false;
    }

    private DirectorySearchRequest withDefaults(DirectorySearchRequest request) {
        var effective = request;
        if (effective.sizeLimit() == 0) {
            effective = effective.withSizeLimit(defaultSizeLimit);
        }
        if (effective.timeLimit() == null) {
            effective = effective.withTimeLimit(defaultTimeLimit);
        }
        return effective;
    }

    private void recordEvent(String event) {
        if (metrics != null) {
            metrics.recordPoolEvent(event);
        }
    }
}
