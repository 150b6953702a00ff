package adsentry.core.model.lockout;

/**
 * Cache key layout for lockout state.
 *
 * <ul>
 *   <li>{@code failed_login:<username>:<ip>} - failed attempt counter</li>
 *   <li>{@code lockout:<username>:<ip>} - cached status for one client address</li>
 *   <li>{@code lockout:<username>} - cached status regardless of address</li>
 * </ul>
 *
 * <p>Pattern methods return Redis glob patterns; the username and address inside
 * them are escaped, so only the trailing or leading {@code *} is a wildcard.
 */
public final class LockoutKeys {

    public static final String FAILED_LOGIN_PREFIX = "failed_login:";
    public static final String LOCKOUT_PREFIX = "lockout:";
    public static final String UNKNOWN_IP = "unknown";

    private LockoutKeys() {}

    public static String failedAttempts(String username, String ipAddress) {
        return FAILED_LOGIN_PREFIX + username + ":" + ipOrUnknown(ipAddress);
    }

    public static String failedAttemptsOfUser(String username) {
        return FAILED_LOGIN_PREFIX + escapeGlob(username) + ":*";
    }

    public static String failedAttemptsFromIp(String ipAddress) {
        return FAILED_LOGIN_PREFIX + "*:" + escapeGlob(ipOrUnknown(ipAddress));
    }

    /**
     * Status key; the username-only key when no address is known.
     */
    public static String lockout(String username, String ipAddress) {
        return ipAddress != null && !ipAddress.isEmpty()
                ? LOCKOUT_PREFIX + username + ":" + ipAddress
                : lockout(username);
    }

    public static String lockout(String username) {
        return LOCKOUT_PREFIX + username;
    }

    public static String lockoutsOfUser(String username) {
        return LOCKOUT_PREFIX + escapeGlob(username) + ":*";
    }

    /**
     * Escapes the glob metacharacters {@code \ * ? [ ]} so the value matches only itself.
     */
    public static String escapeGlob(String value) {
        final var escaped = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            final var c = value.charAt(i);
            if (c == '\\' || c == '*' || c == '?' || c == '[' || c == ']') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    private static String ipOrUnknown(String ipAddress) {
        return ipAddress != null && !ipAddress.isEmpty() ? ipAddress : UNKNOWN_IP;
    }
}
