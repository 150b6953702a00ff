package adsentry.adapter.out.directory;

import adsentry.core.model.directory.DirectoryException;

/**
 * Opens bound connections to the directory server.
 *
 * @see LdapConnectionFactory
 */
public interface DirectoryConnectionFactory {

    /**
     * Open a connection bound as the configured service account, for pooling.
     *
     * @throws DirectoryException if the server is unreachable or rejected the bind
     */
    DirectoryConnection openServiceConnection();

    /**
     * Open a connection bound as an end user. Such connections are never pooled.
     *
     * @param bindDn   the user's DN
     * @param password the user's password, must not be empty
     * @throws DirectoryException if the server is unreachable or rejected the bind
     */
    DirectoryConnection openUserConnection(String bindDn, String password);

    /**
     * Open a service account connection with the short probe timeouts.
     *
     * @throws DirectoryException if the server is unreachable or rejected the bind
     */
    DirectoryConnection openProbeConnection();
}
