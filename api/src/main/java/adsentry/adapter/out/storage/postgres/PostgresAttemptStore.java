package adsentry.adapter.out.storage.postgres;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.arc.DefaultBean;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.sqlclient.Pool;
import io.vertx.mutiny.sqlclient.Row;
import io.vertx.mutiny.sqlclient.RowSet;
import io.vertx.mutiny.sqlclient.Tuple;
import org.jboss.logging.Logger;

import adsentry.core.config.ResiliencyConfig;
import adsentry.core.model.lockout.AccountLockout;
import adsentry.core.model.lockout.FailedLoginAttempt;
import adsentry.core.port.out.AttemptStore;
import adsentry.spi.LockoutStoreException;

/**
 * PostgreSQL implementation of AttemptStore.
 *
 * <p>This is the default implementation for production deployments. Every
 * query is parameterized; optional address filters are expressed in SQL so
 * one statement serves both the per-address and the all-addresses case.
 *
 * <h2>Schema</h2>
 * See {@code db/postgres/V1__lockout_tables.sql}.
 */
@ApplicationScoped
@DefaultBean
public class PostgresAttemptStore implements AttemptStore {

    private static final Logger LOG = Logger.getLogger(PostgresAttemptStore.class);

    static final String INSERT_ATTEMPT =
            """
            INSERT INTO failed_login_attempts (username, ip_address, user_agent, auth_source, error_type, attempted_at)
            VALUES ($1, $2, $3, $4, $5, $6)
            """;

    static final String COUNT_ATTEMPTS =
            """
            SELECT COUNT(*) AS attempts FROM failed_login_attempts
            WHERE username = $1 AND ($2::text IS NULL OR ip_address = $2::text) AND attempted_at > $3
            """;

    static final String DELETE_ATTEMPTS =
            """
            DELETE FROM failed_login_attempts
            WHERE username = $1 AND ($2::text IS NULL OR ip_address = $2::text) AND attempted_at > $3
            """;

    static final String DELETE_ALL_ATTEMPTS = "DELETE FROM failed_login_attempts WHERE username = $1";

    static final String COUNT_LOCKOUTS = "SELECT COUNT(*) AS lockouts FROM account_lockouts WHERE username = $1";

    static final String INSERT_LOCKOUT =
            """
            INSERT INTO account_lockouts
                (username, ip_address, lockout_reason, failed_attempts, lockout_duration_minutes, locked_at, expires_at)
            VALUES ($1, $2, $3, $4, $5, $6, $7)
            RETURNING id
            """;

    static final String FIND_ACTIVE_LOCKOUT =
            """
            SELECT * FROM account_lockouts
            WHERE username = $1
              AND ($2::text IS NULL OR ip_address IS NULL OR ip_address = $2::text)
              AND unlocked_at IS NULL
              AND expires_at > $3
            ORDER BY expires_at DESC
            LIMIT 1
            """;

    static final String UNLOCK =
            """
            UPDATE account_lockouts
            SET unlocked_at = $2, unlocked_by = $3, unlock_reason = $4
            WHERE username = $1 AND unlocked_at IS NULL AND expires_at > $2
            """;

    static final String LOCKOUT_HISTORY =
            """
            SELECT * FROM account_lockouts
            WHERE username = $1
            ORDER BY locked_at DESC, id DESC
            LIMIT $2::integer
            """;

    static final String ACTIVE_LOCKOUTS =
            """
            SELECT DISTINCT ON (username) * FROM account_lockouts
            WHERE unlocked_at IS NULL AND expires_at > $1
            ORDER BY username, locked_at DESC
            LIMIT $2::integer
            """;

    private final Pool pool;
    private final ResiliencyConfig.PostgresConfig timeouts;

    @Inject
    public PostgresAttemptStore(Pool pool, ResiliencyConfig resiliencyConfig) {
        this.pool = pool;
        this.timeouts = resiliencyConfig.postgres();
        LOG.info("Initialized PostgreSQL attempt store");
    }

    @Override
    public Uni<Void> saveAttempt(FailedLoginAttempt attempt) {
        final var params = params(
                attempt.username(),
                attempt.ipAddress(),
                attempt.userAgent(),
                attempt.authSource(),
                attempt.errorType().value(),
                timestamp(attempt.attemptedAt()));
        return execute(INSERT_ATTEMPT, params, "saveAttempt").replaceWithVoid();
    }

    @Override
    public Uni<Integer> countAttemptsSince(String username, String ipAddress, Instant since) {
        return execute(COUNT_ATTEMPTS, params(username, ipAddress, timestamp(since)), "countAttemptsSince")
                .map(rows -> firstLong(rows, "attempts").intValue());
    }

    @Override
    public Uni<Integer> deleteAttemptsSince(String username, String ipAddress, Instant since) {
        return execute(DELETE_ATTEMPTS, params(username, ipAddress, timestamp(since)), "deleteAttemptsSince")
                .map(RowSet::rowCount);
    }

    @Override
    public Uni<Integer> countLockouts(String username) {
        return execute(COUNT_LOCKOUTS, params(username), "countLockouts")
                .map(rows -> firstLong(rows, "lockouts").intValue());
    }

    @Override
    public Uni<AccountLockout> saveLockout(AccountLockout lockout) {
        final var params = params(
                lockout.username(),
                lockout.ipAddress(),
                lockout.reason(),
                lockout.failedAttempts(),
                lockout.lockoutDurationMinutes(),
                timestamp(lockout.lockedAt()),
                timestamp(lockout.expiresAt()));
        return execute(INSERT_LOCKOUT, params, "saveLockout")
                .map(rows -> lockout.withId(rows.iterator().next().getLong("id")));
    }

    @Override
    public Uni<Optional<AccountLockout>> findActiveLockout(String username, String ipAddress, Instant now) {
        return execute(FIND_ACTIVE_LOCKOUT, params(username, ipAddress, timestamp(now)), "findActiveLockout")
                .map(rows -> {
                    final var iterator = rows.iterator();
                    return iterator.hasNext() ? Optional.of(toLockout(iterator.next())) : Optional.empty();
                });
    }

    @Override
    public Uni<Integer> unlock(String username, String unlockedBy, String reason, Instant now) {
        final Uni<Integer> transaction = pool.withTransaction(connection -> connection
                .preparedQuery(UNLOCK)
                .execute(params(username, timestamp(now), unlockedBy, reason))
                .map(RowSet::rowCount)
                .call(released -> connection
                        .preparedQuery(DELETE_ALL_ATTEMPTS)
                        .execute(params(username))
                        .invoke(deleted -> LOG.debugf(
                                "Deleted %d failed logins of %s", deleted.rowCount(), username))));
        return withTimeout(transaction, "unlock");
    }

    @Override
    public Uni<List<AccountLockout>> findLockoutHistory(String username, int limit) {
        return execute(LOCKOUT_HISTORY, params(username, limit), "findLockoutHistory")
                .map(PostgresAttemptStore::toLockouts);
    }

    @Override
    public Uni<List<AccountLockout>> findActiveLockouts(Instant now, int limit) {
        return execute(ACTIVE_LOCKOUTS, params(timestamp(now), limit), "findActiveLockouts")
                .map(PostgresAttemptStore::toLockouts);
    }

    private Uni<RowSet<Row>> execute(String sql, Tuple params, String operation) {
        return withTimeout(pool.preparedQuery(sql).execute(params), operation);
    }

    private <T> Uni<T> withTimeout(Uni<T> query, String operation) {
        return query.ifNoItem()
                .after(timeouts.queryTimeout())
                .failWith(() -> new LockoutStoreException(
                        "PostgreSQL " + operation + " timed out after " + timeouts.queryTimeout()))
                .onFailure(error -> !(error instanceof LockoutStoreException))
                .transform(error -> new LockoutStoreException("PostgreSQL " + operation + " failed", error));
    }

    static AccountLockout toLockout(Row row) {
        return new AccountLockout(
                row.getLong("id"),
                row.getString("username"),
                row.getString("ip_address"),
                row.getString("lockout_reason"),
                row.getInteger("failed_attempts"),
                row.getInteger("lockout_duration_minutes"),
                instant(row.getOffsetDateTime("locked_at")),
                instant(row.getOffsetDateTime("expires_at")),
                instant(row.getOffsetDateTime("unlocked_at")),
                row.getString("unlocked_by"),
                row.getString("unlock_reason"));
    }

    private static List<AccountLockout> toLockouts(RowSet<Row> rows) {
        final var lockouts = new ArrayList<AccountLockout>(rows.size());
        for (final var row : rows) {
            lockouts.add(toLockout(row));
        }
        return lockouts;
    }

    private static Long firstLong(RowSet<Row> rows, String column) {
        final var iterator = rows.iterator();
        if (!iterator.hasNext()) {
            return 0L;
        }
        final var value = iterator.next().getLong(column);
        return value != null ? value : 0L;
    }

    private static Tuple params(Object... values) {
        final var tuple = Tuple.tuple();
        for (final var value : values) {
            tuple.addValue(value);
        }
        return tuple;
    }

    private static OffsetDateTime timestamp(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }

    private static Instant instant(OffsetDateTime timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
