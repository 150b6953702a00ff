package adsentry.core.model.directory;

import java.time.Duration;
import java.util.List;

/**
 * Parameters of a directory search.
 *
 * <p>{@code sizeLimit} and {@code timeLimit} may be left unset (0 and null); the directory
 * client then applies its configured defaults (1000 entries, 30 seconds).
 *
 * @param filter     LDAP filter string, e.g. {@code (sAMAccountName=jdoe)}
 * @param scope      search scope (default: SUB)
 * @param attributes attributes to return (empty for all user attributes)
 * @param sizeLimit  maximum entries returned, 0 for the client default
 * @param timeLimit  server-side time limit, null for the client default
 */
public record DirectorySearchRequest(
        String filter, SearchScope scope, List<String> attributes, int sizeLimit, Duration timeLimit) {

    public DirectorySearchRequest {
        if (filter == null || filter.isBlank()) {
            throw new IllegalArgumentException("Search filter cannot be null or blank");
        }
        if (sizeLimit < 0) {
            throw new IllegalArgumentException("Size limit cannot be negative");
        }
        scope = scope != null ? scope : SearchScope.SUB;
        attributes = attributes != null ? List.copyOf(attributes) : List.of();
    }

    /**
     * Subtree search with client defaults for the limits.
     */
    public static DirectorySearchRequest subtree(String filter, List<String> attributes) {
        return new DirectorySearchRequest(filter, SearchScope.SUB, attributes, 0, null);
    }

    public DirectorySearchRequest withSizeLimit(int limit) {
        return new DirectorySearchRequest(filter, scope, attributes, limit, timeLimit);
    }

    public DirectorySearchRequest withTimeLimit(Duration limit) {
        return new DirectorySearchRequest(filter, scope, attributes, sizeLimit, limit);
    }
}
