package adsentry.adapter.out.directory;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import com.unboundid.ldap.sdk.Filter;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import adsentry.core.model.directory.ConnectionPoolStats;
import adsentry.core.model.directory.DirectoryEntry;
import adsentry.core.model.directory.DirectoryError;
import adsentry.core.model.directory.DirectoryException;
import adsentry.core.model.directory.DirectorySearchRequest;
import adsentry.core.model.directory.UserAccountControl;
import adsentry.core.model.directory.UsernameFormat;
import adsentry.core.port.out.DirectoryClient;
import adsentry.core.port.out.SecurityMetrics;

/**
 * LDAP implementation of {@link DirectoryClient} for Active Directory.
 *
 * <p>User lookups run on pooled service account connections. Password checks bind
 * the found entry's DN on a separate connection that is closed right after the
 * bind and never pooled.
 *
 * <p>The UnboundID SDK is blocking, so every operation runs on the Mutiny worker pool.
 */
public class LdapDirectoryClient implements DirectoryClient, AutoCloseable {

    private static final Logger LOG = Logger.getLogger(LdapDirectoryClient.class);

    static final String SAM_ACCOUNT_NAME = "sAMAccountName";
    static final String USER_PRINCIPAL_NAME = "userPrincipalName";
    static final String MEMBER_OF = "memberOf";

    /** Attributes returned by {@link #getUser}. */
    static final List<String> USER_ATTRIBUTES = List.of(
            SAM_ACCOUNT_NAME,
            "displayName",
            "mail",
            USER_PRINCIPAL_NAME,
            "givenName",
            "sn",
            "department",
            "title",
            "company",
            "manager",
            "telephoneNumber",
            "mobile",
            "physicalDeliveryOfficeName",
            "lastLogonTimestamp",
            "pwdLastSet",
            "accountExpires",
            UserAccountControl.ATTRIBUTE,
            MEMBER_OF,
            "whenCreated",
            "whenChanged",
            "objectGUID");

    private static final List<String> LOOKUP_ATTRIBUTES = List.of(SAM_ACCOUNT_NAME, USER_PRINCIPAL_NAME);

    private final DirectoryConnectionFactory factory;
    private final DirectoryConnectionPool pool;
    private final SecurityMetrics metrics;

    public LdapDirectoryClient(
            DirectoryConnectionFactory factory, DirectoryConnectionPool pool, SecurityMetrics metrics) {
        this.factory = factory;
        this.pool = pool;
        this.metrics = metrics;
    }

    @Override
    public Uni<Boolean> authenticate(String username, String password) {
        // An empty password would be an anonymous bind and succeed
        if (password == null || password.isEmpty()) {
            LOG.debugf("Authentication rejected for %s: empty password", username);
            recordAuthentication(false);
            return Uni.createFrom().item(false);
        }

        final UsernameFormat format;
        try {
            format = UsernameFormat.parse(username);
        } catch (IllegalArgumentException e) {
            LOG.debugf("Authentication rejected: %s", e.getMessage());
            recordAuthentication(false);
            return Uni.createFrom().item(false);
        }

        return blocking(() -> {
            final var authenticated = verifyPassword(format, password);
            recordAuthentication(authenticated);
            return authenticated;
        });
    }

    private boolean verifyPassword(UsernameFormat format, String password) {
        try {
            final var entry = findUser(format, LOOKUP_ATTRIBUTES);
            if (entry.isEmpty()) {
                LOG.debugf("Authentication failed: no directory entry for %s", format.lookupValue());
                return false;
            }
            final var connection = factory.openUserConnection(entry.get().dn(), password);
            connection.close();
            LOG.debugf("Authentication succeeded for %s", format.lookupValue());
            return true;
        } catch (DirectoryException e) {
            if (e.isInvalidCredentials()) {
                LOG.debugf("Directory rejected the credentials of %s", format.lookupValue());
            } else {
                LOG.errorv(e, "Directory authentication failed for {0}", format.lookupValue());
            }
            return false;
        } catch (RuntimeException e) {
            LOG.errorv(e, "Unexpected error authenticating {0}", format.lookupValue());
            return false;
        }
    }

    @Override
    public Uni<Optional<DirectoryEntry>> getUser(String username) {
        return blocking(() -> lookup(username, USER_ATTRIBUTES));
    }

    @Override
    public Uni<List<String>> getUserGroups(String username) {
        return blocking(() -> lookup(username, List.of(MEMBER_OF))
                .map(entry -> entry.values(MEMBER_OF))
                .orElse(List.of()));
    }

    private Optional<DirectoryEntry> lookup(String username, List<String> attributes) {
        try {
            return findUser(UsernameFormat.parse(username), attributes);
        } catch (IllegalArgumentException e) {
            LOG.debugf("Directory lookup skipped: %s", e.getMessage());
            return Optional.empty();
        } catch (DirectoryException e) {
            LOG.warnv(e, "Directory lookup failed for {0}", username);
            return Optional.empty();
        }
    }

    private Optional<DirectoryEntry> findUser(UsernameFormat format, List<String> attributes) {
        final var byAccountName = Filter.createEqualityFilter(SAM_ACCOUNT_NAME, format.lookupValue());
        final var filter = format.userPrincipalName()
                .map(upn -> Filter.createORFilter(
                        byAccountName, Filter.createEqualityFilter(USER_PRINCIPAL_NAME, upn)))
                .orElse(byAccountName);

        final var entries = pool.search(DirectorySearchRequest.subtree(filter.toString(), attributes));
        return entries.stream().findFirst();
    }

    @Override
    public Uni<List<DirectoryEntry>> search(DirectorySearchRequest request) {
        return blocking(() -> pool.search(request));
    }

    @Override
    public Uni<Boolean> testConnection() {
        return blocking(() -> {
            try {
                factory.openProbeConnection().close();
                return true;
            } catch (DirectoryException e) {
                if (e.error().provesServerReachable()) {
                    LOG.debugv("Directory reachable, answered with {0}", e.error());
                    return true;
                }
                if (e.error() == DirectoryError.NETWORK) {
                    LOG.warnv(
                            "Directory unreachable ({0}): {1}",
                            e.networkError().map(Enum::name).orElse("NETWORK"),
                            e.getMessage());
                    return false;
                }
                LOG.errorv(e, "Directory connection test failed");
                return false;
            }
        });
    }

    @Override
    public ConnectionPoolStats poolStats() {
        return new ConnectionPoolStats(pool.idleCount(), pool.maxConnections());
    }

    @Override
    public void close() {
        pool.close();
        LOG.info("Directory client closed");
    }

    private void recordAuthentication(boolean success) {
        if (metrics != null) {
            metrics.recordAuthentication(success);
        }
    }

    private static <T> Uni<T> blocking(Supplier<T> work) {
        return Uni.createFrom().item(work).runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }
}
