package adsentry.adapter.out.storage.postgres;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import io.vertx.mutiny.sqlclient.Pool;
import org.jboss.logging.Logger;

import adsentry.core.config.LockoutConfig;
import adsentry.core.config.ResiliencyConfig;
import adsentry.spi.LockoutStoreException;

/**
 * Applies the lockout schema script on startup when
 * {@code adsentry.lockout.store.initialize-schema} is set.
 *
 * <p>The script is read from the classpath at {@code db/postgres/}. Every
 * statement in it must be idempotent ({@code IF NOT EXISTS}).
 */
@ApplicationScoped
public class PostgresSchemaInitializer {

    private static final Logger LOG = Logger.getLogger(PostgresSchemaInitializer.class);

    static final String SCHEMA_SCRIPT = "db/postgres/V1__lockout_tables.sql";

    private final LockoutConfig lockoutConfig;
    private final ResiliencyConfig resiliencyConfig;
    private final Pool pool;

    @Inject
    public PostgresSchemaInitializer(LockoutConfig lockoutConfig, ResiliencyConfig resiliencyConfig, Pool pool) {
        this.lockoutConfig = lockoutConfig;
        this.resiliencyConfig = resiliencyConfig;
        this.pool = pool;
    }

    void onStart(@Observes StartupEvent event) {
        if (lockoutConfig.store().initializeSchema()) {
            initialize();
        }
    }

    /**
     * Run every statement of the schema script.
     *
     * @return the number of statements executed
     * @throws LockoutStoreException if the script cannot be read or a statement fails
     */
    public int initialize() {
        final var statements = statements(readScript());
        for (final var statement : statements) {
            try {
                pool.query(statement).execute().await().atMost(resiliencyConfig.postgres().queryTimeout());
            } catch (RuntimeException e) {
                throw new LockoutStoreException("Failed to apply lockout schema statement: " + statement, e);
            }
        }
        LOG.infov("Applied lockout schema ({0} statements)", statements.size());
        return statements.size();
    }

    static List<String> statements(String script) {
        final var statements = new ArrayList<String>();
        for (final var chunk : script.split(";")) {
            final var statement = stripComments(chunk).trim();
            if (!statement.isEmpty()) {
                statements.add(statement);
            }
        }
        return statements;
    }

    private static String stripComments(String chunk) {
        final var kept = new StringBuilder();
        for (final var line : chunk.split("\n")) {
            if (!line.trim().startsWith("--")) {
                kept.append(line).append('\n');
            }
        }
        return kept.toString();
    }

    private String readScript() {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(SCHEMA_SCRIPT)) {
            if (is == null) {
                throw new LockoutStoreException("Schema script not found: " + SCHEMA_SCRIPT);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LockoutStoreException("Failed to read schema script: " + SCHEMA_SCRIPT, e);
        }
    }
}
