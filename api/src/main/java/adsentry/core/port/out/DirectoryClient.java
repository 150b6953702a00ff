package adsentry.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import adsentry.core.model.directory.ConnectionPoolStats;
import adsentry.core.model.directory.DirectoryEntry;
import adsentry.core.model.directory.DirectorySearchRequest;

/**
 * Port interface for the directory server (Active Directory or another LDAP server).
 *
 * <p>Implementations keep a pool of connections bound as a service account for
 * searches. Credential verification binds the end user on a separate connection
 * that is never pooled.
 */
public interface DirectoryClient {

    /**
     * Verify a user's password by binding as the user's entry.
     *
     * <p>Accepts <code>DOMAIN&#92;user</code>, {@code user@domain} and plain account names.
     * Never fails: a missing user, a rejected bind and an unreachable server all
     * resolve to {@code false}. Use {@link #testConnection()} to tell them apart.
     *
     * @param username login name as typed
     * @param password password to verify
     * @return Uni with true if the directory accepted the credentials
     */
    Uni<Boolean> authenticate(String username, String password);

    /**
     * Look up a user entry with its profile attributes.
     *
     * @param username login name in any accepted format
     * @return Uni with the entry, or empty if not found or the lookup failed
     */
    Uni<Optional<DirectoryEntry>> getUser(String username);

    /**
     * DNs of the groups a user is a direct member of ({@code memberOf}).
     *
     * @param username login name in any accepted format
     * @return Uni with group DNs, empty if the user is unknown or the lookup failed
     */
    Uni<List<String>> getUserGroups(String username);

    /**
     * Run a search below the configured base DN using a pooled connection.
     *
     * @param request search parameters
     * @return Uni with the matching entries; fails with
     *     {@link adsentry.core.model.directory.DirectoryException} on error
     */
    Uni<List<DirectoryEntry>> search(DirectorySearchRequest request);

    /**
     * Check whether the directory server is reachable, independently of the pool.
     *
     * <p>A server that rejects the service credentials, or answers busy or
     * unwilling, is reachable.
     *
     * @return Uni with true if the server answered
     */
    Uni<Boolean> testConnection();

    /**
     * Current pool statistics, for health reporting.
     */
    ConnectionPoolStats poolStats();
}
