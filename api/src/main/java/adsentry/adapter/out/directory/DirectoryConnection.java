package adsentry.adapter.out.directory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import com.unboundid.ldap.sdk.Filter;
import com.unboundid.ldap.sdk.LDAPConnection;
import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.SearchRequest;
import com.unboundid.ldap.sdk.SearchResultEntry;

import adsentry.core.model.directory.DirectoryEntry;
import adsentry.core.model.directory.DirectoryException;
import adsentry.core.model.directory.DirectorySearchRequest;
import adsentry.core.model.directory.SearchScope;

/**
 * One bound session with the directory server.
 *
 * <p>Not thread-safe: a connection is used by one caller at a time, either idle in
 * a {@link DirectoryConnectionPool} or checked out of it.
 */
public class DirectoryConnection {

    private static final String NO_ATTRIBUTES = "1.1";

    private final LDAPConnection ldap;
    private final String principal;
    private final Instant createdAt;

    public DirectoryConnection(LDAPConnection ldap, String principal) {
        this.ldap = ldap;
        this.principal = principal;
        this.createdAt = Instant.now();
    }

    /** Name the connection is bound as. */
    public String principal() {
        return principal;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /**
     * Verify the session is still usable with a base-scope {@code (objectClass=*)}
     * read of {@code baseDn}.
     *
     * @throws DirectoryException if the server rejected the read or could not be reached
     */
    public void checkHealth(String baseDn, Duration timeLimit) {
        final var request = new SearchRequest(
                baseDn,
                com.unboundid.ldap.sdk.SearchScope.BASE,
                Filter.createPresenceFilter("objectClass"),
                NO_ATTRIBUTES);
        request.setSizeLimit(1);
        request.setTimeLimitSeconds(seconds(timeLimit));
        request.setResponseTimeoutMillis(timeLimit.toMillis());
        try {
            ldap.search(request);
        } catch (LDAPException e) {
            throw DirectoryErrors.classify(e, "Directory connection health check failed");
        }
    }

    /**
     * Run a search below {@code baseDn}. The request's limits must already be resolved.
     *
     * @throws DirectoryException if the search failed or exceeded its limits
     */
    public List<DirectoryEntry> search(String baseDn, DirectorySearchRequest search) {
        try {
            final var request = new SearchRequest(
                    baseDn,
                    toSdkScope(search.scope()),
                    Filter.create(search.filter()),
                    search.attributes().toArray(new String[0]));
            request.setSizeLimit(search.sizeLimit());
            if (search.timeLimit() != null) {
                request.setTimeLimitSeconds(seconds(search.timeLimit()));
            }
            final var result = ldap.search(request);
            final var entries = new ArrayList<DirectoryEntry>(result.getEntryCount());
            for (final var entry : result.getSearchEntries()) {
                entries.add(toEntry(entry));
            }
            return entries;
        } catch (LDAPException e) {
            throw DirectoryErrors.classify(e, "Directory search failed for " + search.filter());
        }
    }

    /** Unbind and close. Safe to call more than once. */
    public void close() {
        ldap.close();
    }

    @Override
    public String toString() {
        return "DirectoryConnection[" + principal + "@" + ldap.getConnectedAddress() + ":" + ldap.getConnectedPort()
                + "]";
    }

    static DirectoryEntry toEntry(SearchResultEntry entry) {
        final var attributes = new LinkedHashMap<String, List<String>>();
        for (final var attribute : entry.getAttributes()) {
            attributes.put(attribute.getName(), List.of(attribute.getValues()));
        }
        return new DirectoryEntry(entry.getDN(), attributes);
    }

    private static com.unboundid.ldap.sdk.SearchScope toSdkScope(SearchScope scope) {
        return switch (scope) {
            case BASE -> com.unboundid.ldap.sdk.SearchScope.BASE;
            case ONE -> com.unboundid.ldap.sdk.SearchScope.ONE;
            case SUB -> com.unboundid.ldap.sdk.SearchScope.SUB;
        };
    }

    private static int seconds(Duration duration) {
        return (int) Math.max(1, duration.toSeconds());
    }
}
