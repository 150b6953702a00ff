package adsentry.adapter.out.directory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Answers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.stubbing.Answer;

import adsentry.core.model.directory.DirectoryEntry;
import adsentry.core.model.directory.DirectoryError;
import adsentry.core.model.directory.DirectoryException;
import adsentry.core.model.directory.DirectorySearchRequest;
import adsentry.core.model.directory.NetworkError;
import adsentry.core.port.out.SecurityMetrics;

@DisplayName("DirectoryConnectionPool")
@ExtendWith(MockitoExtension.class)
class DirectoryConnectionPoolTest {

    private static final String BASE_DN = "DC=corp,DC=example,DC=com";
    private static final DirectorySearchRequest SEARCH =
            DirectorySearchRequest.subtree("(sAMAccountName=jdoe)", List.of("cn"));

    @Mock
    private DirectoryConnectionFactory factory;

    @Mock
    private SecurityMetrics metrics;

    private DirectoryConnectionPool pool;

    @BeforeEach
    void setUp() {
        pool = new DirectoryConnectionPool(factory, BASE_DN, 2, 2, 1000, Duration.ofSeconds(30), metrics);
    }

    private static DirectoryException error(DirectoryError error) {
        return new DirectoryException(error, error.resultCode(), "test " + error, null);
    }

    @Nested
    @DisplayName("acquire() and release()")
    class AcquireReleaseTests {

        @Test
        @DisplayName("should create a connection when none is idle")
        void shouldCreateWhenEmpty() {
            final var connection = mock(DirectoryConnection.class);
            when(factory.openServiceConnection()).thenReturn(connection);

            assertSame(connection, pool.acquire());
            verify(metrics).recordPoolEvent("created");
        }

        @Test
        @DisplayName("should reuse a healthy idle connection")
        void shouldReuseIdle() {
            final var connection = mock(DirectoryConnection.class);
            pool.release(connection);

            assertSame(connection, pool.acquire());
            verify(connection).checkHealth(BASE_DN, DirectoryConnectionPool.HEALTH_CHECK_TIME_LIMIT);
            verify(factory, never()).openServiceConnection();
            verify(metrics).recordPoolEvent("reused");
        }

        @Test
        @DisplayName("should discard an unhealthy idle connection")
        void shouldDiscardUnhealthy() {
            final var stale = mock(DirectoryConnection.class);
            final var fresh = mock(DirectoryConnection.class);
            doThrow(error(DirectoryError.NETWORK)).when(stale).checkHealth(any(), any());
            when(factory.openServiceConnection()).thenReturn(fresh);
            pool.release(stale);

            assertSame(fresh, pool.acquire());
            verify(stale).close();
        }

        @Test
        @DisplayName("should flush the pool when the service credentials are rejected")
        void shouldFlushOnInvalidCredentials() {
            final var first = mock(DirectoryConnection.class);
            final var second = mock(DirectoryConnection.class);
            final var fresh = mock(DirectoryConnection.class);
            pool.release(second);
            pool.release(first);
            doThrow(error(DirectoryError.INVALID_CREDENTIALS)).when(first).checkHealth(any(), any());
            when(factory.openServiceConnection()).thenReturn(fresh);

            assertSame(fresh, pool.acquire());
            verify(first).close();
            verify(second).close();
            verify(second, never()).checkHealth(any(), any());
            assertEquals(0, pool.idleCount());
        }

        @Test
        @DisplayName("should never hold more than the maximum idle connections")
        void shouldBoundIdleConnections() {
            final var a = mock(DirectoryConnection.class);
            final var b = mock(DirectoryConnection.class);
            final var c = mock(DirectoryConnection.class);

            pool.release(a);
            pool.release(b);
            pool.release(c);

            assertEquals(2, pool.idleCount());
            verify(c).close();
            verify(a, never()).close();
        }

        @Test
        @DisplayName("should ignore a second release of the same connection")
        void shouldIgnoreDuplicateRelease() {
            final var connection = mock(DirectoryConnection.class);

            pool.release(connection);
            pool.release(connection);

            assertEquals(1, pool.idleCount());
            verify(connection, never()).close();
        }

        @Test
        @DisplayName("should propagate a failure to open a connection")
        void shouldPropagateOpenFailure() {
            when(factory.openServiceConnection()).thenThrow(error(DirectoryError.NETWORK));

            final var thrown = assertThrows(DirectoryException.class, pool::acquire);

            assertEquals(DirectoryError.NETWORK, thrown.error());
        }

        @Test
        @DisplayName("should refuse acquisition once closed")
        void shouldRefuseWhenClosed() {
            final var connection = mock(DirectoryConnection.class);
            pool.release(connection);

            pool.close();

            assertTrue(pool.isClosed());
            verify(connection).close();
            assertThrows(IllegalStateException.class, pool::acquire);
        }
    }

    @Nested
    @DisplayName("search()")
    class SearchTests {

        private final DirectoryEntry entry = new DirectoryEntry(
                "CN=John Doe,OU=Users," + BASE_DN, Map.of("cn", List.of("John Doe")));

        @Test
        @DisplayName("should apply default limits and return the connection")
        void shouldApplyDefaults() {
            final var connection = mock(DirectoryConnection.class);
            when(factory.openServiceConnection()).thenReturn(connection);
            when(connection.search(eq(BASE_DN), any())).thenReturn(List.of(entry));

            final var result = pool.search(SEARCH);

            assertEquals(List.of(entry), result);
            final var captor = ArgumentCaptor.forClass(DirectorySearchRequest.class);
            verify(connection).search(eq(BASE_DN), captor.capture());
            assertEquals(1000, captor.getValue().sizeLimit());
            assertEquals(Duration.ofSeconds(30), captor.getValue().timeLimit());
            assertEquals(1, pool.idleCount());
        }

        @Test
        @DisplayName("should keep explicit limits")
        void shouldKeepExplicitLimits() {
            final var connection = mock(DirectoryConnection.class);
            when(factory.openServiceConnection()).thenReturn(connection);
            when(connection.search(eq(BASE_DN), any())).thenReturn(List.of());

            pool.search(SEARCH.withSizeLimit(5).withTimeLimit(Duration.ofSeconds(2)));

            final var captor = ArgumentCaptor.forClass(DirectorySearchRequest.class);
            verify(connection).search(eq(BASE_DN), captor.capture());
            assertEquals(5, captor.getValue().sizeLimit());
            assertEquals(Duration.ofSeconds(2), captor.getValue().timeLimit());
        }

        @Test
        @DisplayName("should retry an unbound session with a fresh connection")
        void shouldRetryUnboundSession() {
            final var unbound = mock(DirectoryConnection.class);
            final var fresh = mock(DirectoryConnection.class);
            when(factory.openServiceConnection()).thenReturn(unbound, fresh);
            when(unbound.search(eq(BASE_DN), any())).thenThrow(error(DirectoryError.SESSION_UNBOUND));
            when(fresh.search(eq(BASE_DN), any())).thenReturn(List.of(entry));

            assertEquals(List.of(entry), pool.search(SEARCH));
            verify(unbound).close();
            assertEquals(1, pool.idleCount());
        }

        @Test
        @DisplayName("should give up after the configured retries")
        void shouldGiveUpAfterRetries() {
            final var a = mock(DirectoryConnection.class);
            final var b = mock(DirectoryConnection.class);
            final var c = mock(DirectoryConnection.class);
            when(factory.openServiceConnection()).thenReturn(a, b, c);
            when(a.search(eq(BASE_DN), any())).thenThrow(error(DirectoryError.SESSION_UNBOUND));
            when(b.search(eq(BASE_DN), any())).thenThrow(error(DirectoryError.SESSION_UNBOUND));
            when(c.search(eq(BASE_DN), any())).thenThrow(error(DirectoryError.SESSION_UNBOUND));

            final var thrown = assertThrows(DirectoryException.class, () -> pool.search(SEARCH));

            assertTrue(thrown.isSessionUnbound());
            verify(factory, times(3)).openServiceConnection();
            verify(c).close();
            assertEquals(0, pool.idleCount());
        }

        @Test
        @DisplayName("should discard the connection on a network error")
        void shouldDiscardOnNetworkError() {
            final var connection = mock(DirectoryConnection.class);
            when(factory.openServiceConnection()).thenReturn(connection);
            when(connection.search(eq(BASE_DN), any()))
                    .thenThrow(new DirectoryException(
                            DirectoryError.NETWORK, 81, NetworkError.CONNECTION_RESET, "reset", null));

            assertThrows(DirectoryException.class, () -> pool.search(SEARCH));

            verify(connection).close();
            assertEquals(0, pool.idleCount());
        }

        @Test
        @DisplayName("should flush the pool when a search is rejected for credentials")
        void shouldFlushOnInvalidCredentials() {
            final var rejected = mock(DirectoryConnection.class);
            final var other = mock(DirectoryConnection.class);
            pool.release(other);
            pool.release(rejected);
            when(rejected.search(eq(BASE_DN), any())).thenThrow(error(DirectoryError.INVALID_CREDENTIALS));

            final var thrown = assertThrows(DirectoryException.class, () -> pool.search(SEARCH));

            assertTrue(thrown.isInvalidCredentials());
            verify(rejected).close();
            verify(other).close();
            assertEquals(0, pool.idleCount());
        }

        @Test
        @DisplayName("should keep the connection after a server-side search error")
        void shouldKeepConnectionOnOtherError() {
            final var connection = mock(DirectoryConnection.class);
            when(factory.openServiceConnection()).thenReturn(connection);
            when(connection.search(eq(BASE_DN), any())).thenThrow(error(DirectoryError.OTHER));

            assertThrows(DirectoryException.class, () -> pool.search(SEARCH));

            verify(connection, never()).close();
            assertEquals(1, pool.idleCount());
        }

        @Test
        @DisplayName("should discard the connection on an unexpected exception")
        void shouldDiscardOnUnexpectedException() {
            final var connection = mock(DirectoryConnection.class);
            when(factory.openServiceConnection()).thenReturn(connection);
            when(connection.search(eq(BASE_DN), any())).thenThrow(new IllegalStateException("boom"));

            assertThrows(IllegalStateException.class, () -> pool.search(SEARCH));

            verify(connection).close();
            assertEquals(0, pool.idleCount());
        }
    }

    @Nested
    @DisplayName("concurrent use")
    class ConcurrencyTests {

        private static final int THREADS = 8;
        private static final int ITERATIONS = 300;

        @Test
        @DisplayName("should never hand one connection to two callers or exceed the idle bound")
        void shouldStaySafeUnderConcurrentCallers() throws Exception {
            final Set<DirectoryConnection> inUse = ConcurrentHashMap.newKeySet();
            final var sharedHandouts = new AtomicInteger();
            final var overflows = new AtomicInteger();
            final Answer<Object> searchTracking = invocation -> {
                if (invocation.getMethod().getName().equals("search")) {
                    final var connection = (DirectoryConnection) invocation.getMock();
                    if (!inUse.add(connection)) {
                        sharedHandouts.incrementAndGet();
                    }
                    Thread.yield();
                    inUse.remove(connection);
                    return List.of();
                }
                return Answers.RETURNS_DEFAULTS.answer(invocation);
            };
            when(factory.openServiceConnection())
                    .thenAnswer(invocation ->
                            mock(DirectoryConnection.class, withSettings().defaultAnswer(searchTracking)));

            final var executor = Executors.newFixedThreadPool(THREADS);
            final var start = new CountDownLatch(1);
            try {
                final List<Future<?>> workers = new ArrayList<>();
                for (int t = 0; t < THREADS; t++) {
                    workers.add(executor.submit(() -> {
                        start.await();
                        for (int i = 0; i < ITERATIONS; i++) {
                            if (i % 2 == 0) {
                                final var connection = pool.acquire();
                                if (!inUse.add(connection)) {
                                    sharedHandouts.incrementAndGet();
                                }
                                Thread.yield();
                                inUse.remove(connection);
                                pool.release(connection);
                            } else {
                                pool.search(SEARCH);
                            }
                            if (pool.idleCount() > pool.maxConnections()) {
                                overflows.incrementAndGet();
                            }
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (final var worker : workers) {
                    worker.get(30, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            assertEquals(0, sharedHandouts.get());
            assertEquals(0, overflows.get());
            assertTrue(pool.idleCount() <= pool.maxConnections());
            assertTrue(inUse.isEmpty());
        }
    }
}
