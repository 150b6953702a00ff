package adsentry.adapter.out.storage.postgres;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.pgclient.PgPool;
import io.vertx.mutiny.sqlclient.Pool;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.sqlclient.PoolOptions;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import adsentry.core.config.LockoutConfig;
import adsentry.core.config.ResiliencyConfig;
import adsentry.core.model.lockout.AccountLockout;
import adsentry.core.model.lockout.FailedLoginAttempt;
import adsentry.core.model.lockout.LoginErrorType;
import adsentry.spi.LockoutStoreException;

@DisplayName("PostgresAttemptStore against PostgreSQL")
@Testcontainers(disabledWithoutDocker = true)
class PostgresAttemptStoreIntegrationTest {

    private static final Duration AWAIT = Duration.ofSeconds(10);

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    private static Vertx vertx;
    private static Pool pool;
    private static PostgresAttemptStore store;

    @BeforeAll
    static void setUp() {
        vertx = Vertx.vertx();
        final var connectOptions = new PgConnectOptions()
                .setHost(POSTGRES.getHost())
                .setPort(POSTGRES.getMappedPort(PostgreSQLContainer.POSTGRESQL_PORT))
                .setDatabase(POSTGRES.getDatabaseName())
                .setUser(POSTGRES.getUsername())
                .setPassword(POSTGRES.getPassword());
        pool = PgPool.pool(vertx, connectOptions, new PoolOptions().setMaxSize(4));

        final var resiliencyConfig = mock(ResiliencyConfig.class);
        final var postgresConfig = mock(ResiliencyConfig.PostgresConfig.class);
        when(resiliencyConfig.postgres()).thenReturn(postgresConfig);
        when(postgresConfig.queryTimeout()).thenReturn(Duration.ofSeconds(5));

        final var applied =
                new PostgresSchemaInitializer(mock(LockoutConfig.class), resiliencyConfig, pool).initialize();
        assertEquals(6, applied);

        store = new PostgresAttemptStore(pool, resiliencyConfig);
    }

    @AfterAll
    static void tearDown() {
        if (pool != null) {
            pool.closeAndAwait();
        }
        if (vertx != null) {
            vertx.closeAndAwait();
        }
    }

    @BeforeEach
    void cleanTables() {
        pool.query("TRUNCATE failed_login_attempts, account_lockouts RESTART IDENTITY")
                .execute()
                .await()
                .atMost(AWAIT);
    }

    private static Instant now() {
        // TIMESTAMPTZ keeps microseconds
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    private static void sql(String statement) {
        pool.query(statement).execute().await().atMost(AWAIT);
    }

    private static void attempt(String username, String ip, Instant at) {
        store.saveAttempt(new FailedLoginAttempt(
                        username, ip, "curl/8.0", "ad", LoginErrorType.INVALID_CREDENTIALS, at))
                .await()
                .atMost(AWAIT);
    }

    private static AccountLockout lockout(String username, String ip, Instant lockedAt, Duration duration) {
        return store.saveLockout(AccountLockout.start(username, ip, "locked", 5, duration, lockedAt))
                .await()
                .atMost(AWAIT);
    }

    @Nested
    @DisplayName("failed attempts")
    class AttemptTests {

        @Test
        @DisplayName("should count attempts in the window, by address or across addresses")
        void shouldCountAttempts() {
            final var now = now();
            attempt("jdoe", "10.0.0.5", now.minus(Duration.ofMinutes(30)));
            attempt("jdoe", "10.0.0.5", now.minus(Duration.ofMinutes(2)));
            attempt("jdoe", "10.0.0.6", now.minus(Duration.ofMinutes(1)));
            attempt("jdoe", null, now);

            final var since = now.minus(Duration.ofMinutes(15));
            assertEquals(1, store.countAttemptsSince("jdoe", "10.0.0.5", since).await().atMost(AWAIT));
            assertEquals(3, store.countAttemptsSince("jdoe", null, since).await().atMost(AWAIT));
            assertEquals(0, store.countAttemptsSince("asmith", null, since).await().atMost(AWAIT));
        }

        @Test
        @DisplayName("should delete only attempts in the window")
        void shouldDeleteInWindow() {
            final var now = now();
            attempt("jdoe", "10.0.0.5", now.minus(Duration.ofMinutes(30)));
            attempt("jdoe", "10.0.0.5", now.minus(Duration.ofMinutes(2)));

            final var deleted = store.deleteAttemptsSince("jdoe", "10.0.0.5", now.minus(Duration.ofMinutes(15)))
                    .await()
                    .atMost(AWAIT);

            assertEquals(1, deleted);
            assertEquals(1, store.countAttemptsSince("jdoe", null, Instant.EPOCH).await().atMost(AWAIT));
        }
    }

    @Nested
    @DisplayName("lockouts")
    class LockoutTests {

        @Test
        @DisplayName("should persist and read back a lockout")
        void shouldRoundTripLockout() {
            final var now = now();
            final var saved = lockout("jdoe", "10.0.0.5", now, Duration.ofMinutes(15));

            assertTrue(saved.id() > 0);
            final var active = store.findActiveLockout("jdoe", "10.0.0.5", now).await().atMost(AWAIT);
            assertTrue(active.isPresent());
            assertEquals(saved.id(), active.get().id());
            assertEquals(now.plus(Duration.ofMinutes(15)), active.get().expiresAt());
            assertEquals(15, active.get().lockoutDurationMinutes());
            assertNull(active.get().unlockedAt());
        }

        @Test
        @DisplayName("should ignore expired lockouts and other addresses")
        void shouldIgnoreExpiredLockouts() {
            final var now = now();
            lockout("jdoe", "10.0.0.5", now.minus(Duration.ofHours(2)), Duration.ofMinutes(15));
            assertFalse(store.findActiveLockout("jdoe", "10.0.0.5", now).await().atMost(AWAIT).isPresent());

            lockout("jdoe", "10.0.0.5", now, Duration.ofMinutes(15));
            assertFalse(store.findActiveLockout("jdoe", "10.0.0.9", now).await().atMost(AWAIT).isPresent());
            assertTrue(store.findActiveLockout("jdoe", null, now).await().atMost(AWAIT).isPresent());
            assertEquals(2, store.countLockouts("jdoe").await().atMost(AWAIT));
        }

        @Test
        @DisplayName("unlock should release active lockouts and delete attempts atomically")
        void shouldUnlock() {
            final var now = now();
            lockout("jdoe", "10.0.0.5", now, Duration.ofMinutes(15));
            attempt("jdoe", "10.0.0.5", now);

            final var released = store.unlock("jdoe", "admin", "verified", now.plusSeconds(1))
                    .await()
                    .atMost(AWAIT);

            assertEquals(1, released);
            assertEquals(0, store.countAttemptsSince("jdoe", null, Instant.EPOCH).await().atMost(AWAIT));
            final var history = store.findLockoutHistory("jdoe", 10).await().atMost(AWAIT);
            assertNotNull(history.get(0).unlockedAt());
            assertEquals("admin", history.get(0).unlockedBy());
            assertEquals(
                    0,
                    store.unlock("jdoe", "admin", "again", now.plusSeconds(2)).await().atMost(AWAIT));
        }

        @Test
        @DisplayName("unlock should roll back the release when deleting attempts fails")
        void shouldRollBackUnlock() {
            final var now = now();
            final var saved = lockout("jdoe", "10.0.0.5", now, Duration.ofMinutes(15));
            attempt("jdoe", "10.0.0.5", now);
            sql("""
                    CREATE OR REPLACE FUNCTION reject_attempt_delete() RETURNS trigger AS $$
                    BEGIN
                        RAISE EXCEPTION 'failed login history is read-only';
                    END;
                    $$ LANGUAGE plpgsql""");
            sql("""
                    CREATE TRIGGER reject_attempt_delete BEFORE DELETE ON failed_login_attempts
                    FOR EACH STATEMENT EXECUTE FUNCTION reject_attempt_delete()""");

            try {
                assertThrows(
                        LockoutStoreException.class,
                        () -> store.unlock("jdoe", "admin", "verified", now.plusSeconds(1))
                                .await()
                                .atMost(AWAIT));
            } finally {
                sql("DROP TRIGGER reject_attempt_delete ON failed_login_attempts");
                sql("DROP FUNCTION reject_attempt_delete()");
            }

            final var active = store.findActiveLockout("jdoe", "10.0.0.5", now.plusSeconds(2))
                    .await()
                    .atMost(AWAIT);
            assertTrue(active.isPresent());
            assertEquals(saved.id(), active.get().id());
            assertNull(active.get().unlockedAt());
            assertEquals(1, store.countAttemptsSince("jdoe", null, Instant.EPOCH).await().atMost(AWAIT));
        }

        @Test
        @DisplayName("should list the newest active lockout per username")
        void shouldListActiveLockouts() {
            final var now = now();
            lockout("jdoe", "10.0.0.5", now.minusSeconds(60), Duration.ofMinutes(15));
            lockout("jdoe", "10.0.0.6", now, Duration.ofMinutes(30));
            lockout("asmith", "10.0.0.7", now, Duration.ofMinutes(15));

            final var active = store.findActiveLockouts(now, 100).await().atMost(AWAIT);

            assertEquals(2, active.size());
            assertEquals("asmith", active.get(0).username());
            assertEquals("10.0.0.6", active.get(1).ipAddress());
        }

        @Test
        @DisplayName("history should be newest first and limited")
        void shouldLimitHistory() {
            final var now = now();
            for (int i = 4; i > 0; i--) {
                lockout("jdoe", null, now.minus(Duration.ofDays(i)), Duration.ofMinutes(15));
            }

            final var history = store.findLockoutHistory("jdoe", 2).await().atMost(AWAIT);

            assertEquals(2, history.size());
            assertEquals(now.minus(Duration.ofDays(1)), history.get(0).lockedAt());
        }
    }
}
