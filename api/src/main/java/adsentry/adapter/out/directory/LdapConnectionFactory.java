package adsentry.adapter.out.directory;

import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.List;

import javax.net.SocketFactory;

import com.unboundid.ldap.sdk.LDAPConnection;
import com.unboundid.ldap.sdk.LDAPConnectionOptions;
import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.LDAPURL;
import com.unboundid.util.ssl.HostNameSSLSocketVerifier;
import com.unboundid.util.ssl.SSLUtil;
import com.unboundid.util.ssl.TrustAllTrustManager;
import org.jboss.logging.Logger;

import adsentry.core.config.DirectoryConfig;
import adsentry.core.model.directory.DirectoryError;
import adsentry.core.model.directory.DirectoryException;

/**
 * UnboundID-backed {@link DirectoryConnectionFactory}.
 *
 * <p>{@code ldaps://} URLs are connected over TLS 1.2 or 1.3 with host name
 * verification, unless {@code adsentry.directory.trust-all-certificates} is set.
 */
public class LdapConnectionFactory implements DirectoryConnectionFactory {

    private static final Logger LOG = Logger.getLogger(LdapConnectionFactory.class);

    private static final String LDAPS = "ldaps";

    static {
        SSLUtil.setEnabledSSLProtocols(List.of(SSLUtil.SSL_PROTOCOL_TLS_1_3, SSLUtil.SSL_PROTOCOL_TLS_1_2));
    }

    private final String host;
    private final int port;
    private final boolean secure;
    private final String bindDn;
    private final String bindPassword;
    private final DirectoryConfig config;
    private final SocketFactory socketFactory;

    public LdapConnectionFactory(DirectoryConfig config) {
        this.config = config;
        final var url = config.url().orElseThrow(() -> new IllegalStateException("adsentry.directory.url is required"));
        try {
            final var ldapUrl = new LDAPURL(url);
            this.host = ldapUrl.getHost();
            this.port = ldapUrl.getPort();
            this.secure = LDAPS.equalsIgnoreCase(ldapUrl.getScheme());
        } catch (LDAPException e) {
            throw new IllegalStateException("Invalid directory URL: " + url, e);
        }
        this.bindDn = config.bindDn().orElse("");
        this.bindPassword = config.bindPassword().orElse("");
        this.socketFactory = secure ? createSslSocketFactory(config.trustAllCertificates()) : null;
        if (secure && config.trustAllCertificates()) {
            LOG.warn("Directory certificate validation is disabled (adsentry.directory.trust-all-certificates)");
        }
        LOG.infof("Directory connection factory targets %s:%d (secure=%s)", host, port, secure);
    }

    @Override
    public DirectoryConnection openServiceConnection() {
        return open(bindDn, bindPassword, config.connectTimeout(), config.responseTimeout());
    }

    @Override
    public DirectoryConnection openUserConnection(String userDn, String password) {
        if (password == null || password.isEmpty()) {
            throw new DirectoryException(
                    DirectoryError.INVALID_CREDENTIALS,
                    DirectoryError.INVALID_CREDENTIALS.resultCode(),
                    "Empty password rejected without bind",
                    null);
        }
        return open(userDn, password, config.connectTimeout(), config.responseTimeout());
    }

    @Override
    public DirectoryConnection openProbeConnection() {
        return open(bindDn, bindPassword, config.probeTimeout(), config.probeTimeout());
    }

    private DirectoryConnection open(String dn, String password, Duration connectTimeout, Duration responseTimeout) {
        final var options = new LDAPConnectionOptions();
        options.setConnectTimeoutMillis((int) connectTimeout.toMillis());
        options.setResponseTimeoutMillis(responseTimeout.toMillis());
        if (secure && !config.trustAllCertificates()) {
            options.setSSLSocketVerifier(new HostNameSSLSocketVerifier(true));
        }

        final LDAPConnection ldap;
        try {
            ldap = new LDAPConnection(socketFactory, options, host, port);
        } catch (LDAPException e) {
            throw DirectoryErrors.classify(e, "Unable to connect to " + host + ":" + port);
        }

        try {
            ldap.bind(dn, password);
        } catch (LDAPException e) {
            ldap.close();
            throw DirectoryErrors.classify(e, "Bind failed for " + dn);
        }
        return new DirectoryConnection(ldap, dn);
    }

    private static SocketFactory createSslSocketFactory(boolean trustAll) {
        final var sslUtil = trustAll ? new SSLUtil(new TrustAllTrustManager()) : new SSLUtil();
        try {
            return sslUtil.createSSLSocketFactory();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to initialize TLS for directory connections", e);
        }
    }
}
