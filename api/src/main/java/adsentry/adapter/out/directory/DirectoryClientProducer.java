package adsentry.adapter.out.directory;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import adsentry.core.config.DirectoryConfig;
import adsentry.core.port.out.DirectoryClient;
import adsentry.core.port.out.SecurityMetrics;

/**
 * CDI producer for the directory client.
 *
 * <p>Builds the connection pool from {@link DirectoryConfig}. When the directory is
 * disabled or its URL or base DN is missing, a client that rejects every login is
 * produced instead, so the application still starts.
 */
@ApplicationScoped
public class DirectoryClientProducer {

    private static final Logger LOG = Logger.getLogger(DirectoryClientProducer.class);

    private final DirectoryConfig config;
    private final SecurityMetrics metrics;
    private LdapDirectoryClient client;

    @Inject
    public DirectoryClientProducer(DirectoryConfig config, SecurityMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
    }

    /**
     * Produces the directory client.
     *
     * @return LDAP client, or a disabled client when the directory is not configured
     */
    @Produces
    @ApplicationScoped
    public DirectoryClient directoryClient() {
        if (!config.isConfigured()) {
            LOG.warn("Directory client is disabled or not configured; all directory logins will fail");
            return new DisabledDirectoryClient();
        }

        final var factory = new LdapConnectionFactory(config);
        final var pool = new DirectoryConnectionPool(
                factory,
                config.baseDn().get(),
                config.maxConnections(),
                config.maxRetries(),
                config.defaultSizeLimit(),
                config.defaultTimeLimit(),
                metrics);
        client = new LdapDirectoryClient(factory, pool, metrics);
        LOG.infof("Directory client initialized (max connections: %d)", config.maxConnections());
        return client;
    }

    @PreDestroy
    void shutdown() {
        if (client != null) {
            client.close();
        }
    }
}
