package adsentry.core.model.directory;

/**
 * Socket-level failure reaching the directory server.
 *
 * <p>All of these mean the server could not be reached at all, as opposed to
 * a {@link DirectoryError} returned by a server that answered.
 */
public enum NetworkError {
    CONNECTION_RESET,
    CONNECTION_REFUSED,
    TIMED_OUT,
    HOST_NOT_FOUND,
    HOST_UNREACHABLE
}
