package adsentry.core.model.directory;

import java.util.Optional;

/**
 * A failed directory operation with its classified cause.
 */
public class DirectoryException extends RuntimeException {

    private final DirectoryError error;
    private final int resultCode;
    private final NetworkError networkError;

    public DirectoryException(DirectoryError error, int resultCode, String message, Throwable cause) {
        this(error, resultCode, null, message, cause);
    }

    public DirectoryException(
            DirectoryError error, int resultCode, NetworkError networkError, String message, Throwable cause) {
        super(message, cause);
        this.error = error != null ? error : DirectoryError.OTHER;
        this.resultCode = resultCode;
        this.networkError = networkError;
    }

    public DirectoryError error() {
        return error;
    }

    /** Raw LDAP result code as reported by the SDK. */
    public int resultCode() {
        return resultCode;
    }

    public Optional<NetworkError> networkError() {
        return Optional.ofNullable(networkError);
    }

    public boolean isInvalidCredentials() {
        return error == DirectoryError.INVALID_CREDENTIALS;
    }

    public boolean isSessionUnbound() {
        return error == DirectoryError.SESSION_UNBOUND;
    }
}
