package adsentry.core.model.auth;

/**
 * Credentials submitted to a directory login, with the client context used for
 * lockout tracking.
 *
 * @param username  login name as typed (<code>DOMAIN&#92;user</code>, {@code user@domain} or {@code user})
 * @param password  password (never logged)
 * @param ipAddress client address (may be null)
 * @param userAgent client user agent (may be null)
 */
public record LoginRequest(String username, String password, String ipAddress, String userAgent) {

    public LoginRequest {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be null or blank");
        }
        username = username.trim();
    }

    @Override
    public String toString() {
        return "LoginRequest[username=" + username + ", ipAddress=" + ipAddress + "]";
    }
}
