package adsentry.spi;

/**
 * Exception thrown when a lockout store or cache backend fails.
 */
public class LockoutStoreException extends RuntimeException {

    public LockoutStoreException(String message) {
        super(message);
    }

    public LockoutStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
