package adsentry.core.model.lockout;

import java.time.Instant;

/**
 * One failed authentication, recorded as it happened and never changed afterwards.
 *
 * @param username   the login name as submitted
 * @param ipAddress  client address (may be null)
 * @param userAgent  client user agent (may be null)
 * @param authSource authentication source tag such as {@code ad} (may be null)
 * @param errorType  failure classification
 * @param attemptedAt server-assigned timestamp
 */
public record FailedLoginAttempt(
        String username,
        String ipAddress,
        String userAgent,
        String authSource,
        LoginErrorType errorType,
        Instant attemptedAt) {

    public FailedLoginAttempt {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be null or blank");
        }
        errorType = errorType != null ? errorType : LoginErrorType.INVALID_CREDENTIALS;
        attemptedAt = attemptedAt != null ? attemptedAt : Instant.now();
    }

    /**
     * Create an attempt stamped with the current time.
     */
    public static FailedLoginAttempt of(
            String username, String ipAddress, String userAgent, String authSource, LoginErrorType errorType) {
        return new FailedLoginAttempt(username, ipAddress, userAgent, authSource, errorType, Instant.now());
    }
}
