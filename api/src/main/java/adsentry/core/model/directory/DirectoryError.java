package adsentry.core.model.directory;

/**
 * Classification of a directory failure, resolved once where the LDAP SDK
 * raises it.
 */
public enum DirectoryError {

    /** Bind rejected, LDAP result code 49. */
    INVALID_CREDENTIALS(49),

    /** Server busy, LDAP result code 51. */
    SERVER_BUSY(51),

    /** Server unavailable, LDAP result code 52. */
    SERVER_UNAVAILABLE(52),

    /** Server unwilling to perform, LDAP result code 53. */
    UNWILLING_TO_PERFORM(53),

    /** Operation attempted on a connection that is no longer bound. */
    SESSION_UNBOUND(1),

    /** The server could not be reached; see {@link NetworkError}. */
    NETWORK(-1),

    /** Any other protocol or server error. */
    OTHER(-1);

    private final int resultCode;

    DirectoryError(int resultCode) {
        this.resultCode = resultCode;
    }

    /**
     * The LDAP result code this error is identified by, or -1 when it is not
     * identified by a single code.
     */
    public int resultCode() {
        return resultCode;
    }

    /**
     * Whether a server answered with this error, proving it is reachable.
     */
    public boolean provesServerReachable() {
        return this == INVALID_CREDENTIALS
                || this == SERVER_BUSY
                || this == SERVER_UNAVAILABLE
                || this == UNWILLING_TO_PERFORM;
    }
}
