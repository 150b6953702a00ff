package adsentry.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the directory (Active Directory / LDAP) client.
 *
 * <p>Configuration prefix: {@code adsentry.directory}
 *
 * <p>The service account configured here is used for every pooled connection.
 * End-user credentials are only ever bound on throwaway connections.
 *
 * @see adsentry.core.port.out.DirectoryClient
 */
@ConfigMapping(prefix = "adsentry.directory")
public interface DirectoryConfig {

    /**
     * Enable the directory client.
     *
     * <p>When disabled, no pool is created and every authentication fails.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Directory server URL, e.g. {@code ldaps://dc01.corp.example.com:636}.
     *
     * <p>{@code ldaps} URLs are connected over TLS 1.2 or newer.
     *
     * @return the server URL
     */
    Optional<String> url();

    /**
     * Base DN for all searches, e.g. {@code DC=corp,DC=example,DC=com}.
     *
     * @return the search base
     */
    Optional<String> baseDn();

    /**
     * Service account used to bind pooled connections. Accepts a DN or any
     * name the server accepts for a simple bind, such as a UPN.
     *
     * @return the service account name
     */
    Optional<String> bindDn();

    /**
     * Service account password.
     *
     * @return the service account password
     */
    Optional<String> bindPassword();

    /**
     * Maximum time to establish a TCP connection.
     *
     * @return connect timeout (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration connectTimeout();

    /**
     * Maximum time to wait for the response to a directory operation.
     *
     * @return response timeout (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration responseTimeout();

    /**
     * Connect and response timeout for health checks and reachability probes.
     *
     * @return probe timeout (default: 5 seconds)
     */
    @WithDefault("PT5S")
    Duration probeTimeout();

    /**
     * Maximum idle connections kept in the pool.
     *
     * @return pool size (default: 5)
     */
    @WithDefault("5")
    int maxConnections();

    /**
     * Retries of a search whose connection turned out to be unbound.
     *
     * @return retry count (default: 2)
     */
    @WithDefault("2")
    int maxRetries();

    /**
     * Size limit applied when a search does not set one.
     *
     * @return default size limit (default: 1000)
     */
    @WithDefault("1000")
    int defaultSizeLimit();

    /**
     * Time limit applied when a search does not set one.
     *
     * @return default time limit (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration defaultTimeLimit();

    /**
     * Accept any server certificate on {@code ldaps} connections.
     *
     * <p>Only for development against self-signed domain controllers.
     *
     * @return true to skip certificate validation (default: false)
     */
    @WithDefault("false")
    boolean trustAllCertificates();

    /**
     * Whether a directory client can be built: enabled with a URL and a base DN.
     */
    default boolean isConfigured() {
        return enabled() && url().isPresent() && baseDn().isPresent();
    }
}
