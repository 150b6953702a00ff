package adsentry.adapter.out.directory;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;

import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.ResultCode;

import adsentry.core.model.directory.DirectoryError;
import adsentry.core.model.directory.DirectoryException;
import adsentry.core.model.directory.NetworkError;

/**
 * Translates UnboundID exceptions into {@link DirectoryException}.
 *
 * <p>Callers above the adapter only ever branch on {@link DirectoryError} and
 * {@link NetworkError}, never on result codes or message text.
 */
final class DirectoryErrors {

    /** Active Directory's diagnostic when an operation runs on an unbound connection. */
    static final String BIND_REQUIRED_MESSAGE = "successful bind must be completed";

    private DirectoryErrors() {}

    static DirectoryException classify(LDAPException e, String context) {
        final var resultCode = e.getResultCode().intValue();
        final var message = context + ": " + e.getExceptionMessage();

        switch (resultCode) {
            case ResultCode.INVALID_CREDENTIALS_INT_VALUE:
                return new DirectoryException(DirectoryError.INVALID_CREDENTIALS, resultCode, message, e);
            case ResultCode.BUSY_INT_VALUE:
                return new DirectoryException(DirectoryError.SERVER_BUSY, resultCode, message, e);
            case ResultCode.UNAVAILABLE_INT_VALUE:
                return new DirectoryException(DirectoryError.SERVER_UNAVAILABLE, resultCode, message, e);
            case ResultCode.UNWILLING_TO_PERFORM_INT_VALUE:
                return new DirectoryException(DirectoryError.UNWILLING_TO_PERFORM, resultCode, message, e);
            case ResultCode.OPERATIONS_ERROR_INT_VALUE:
                if (mentions(e, BIND_REQUIRED_MESSAGE)) {
                    return new DirectoryException(DirectoryError.SESSION_UNBOUND, resultCode, message, e);
                }
                break;
            default:
                break;
        }

        final var network = networkError(e);
        if (network != null) {
            return new DirectoryException(DirectoryError.NETWORK, resultCode, network, message, e);
        }
        if (resultCode == ResultCode.CONNECT_ERROR_INT_VALUE
                || resultCode == ResultCode.SERVER_DOWN_INT_VALUE
                || resultCode == ResultCode.TIMEOUT_INT_VALUE) {
            final var fallback = resultCode == ResultCode.TIMEOUT_INT_VALUE ? NetworkError.TIMED_OUT : null;
            return new DirectoryException(DirectoryError.NETWORK, resultCode, fallback, message, e);
        }
        return new DirectoryException(DirectoryError.OTHER, resultCode, message, e);
    }

    /**
     * Socket-level cause of a failure, found in the cause chain or, when the SDK
     * flattened it, in the message text.
     */
    static NetworkError networkError(Throwable error) {
        for (var cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConnectException) {
                return NetworkError.CONNECTION_REFUSED;
            }
            if (cause instanceof NoRouteToHostException) {
                return NetworkError.HOST_UNREACHABLE;
            }
            if (cause instanceof UnknownHostException) {
                return NetworkError.HOST_NOT_FOUND;
            }
            if (cause instanceof SocketTimeoutException) {
                return NetworkError.TIMED_OUT;
            }
            if (cause instanceof SocketException && containsIgnoreCase(cause.getMessage(), "reset")) {
                return NetworkError.CONNECTION_RESET;
            }
            if (cause.getCause() == cause) {
                break;
            }
        }

        final var text = error.getMessage();
        if (containsIgnoreCase(text, "connection refused")) {
            return NetworkError.CONNECTION_REFUSED;
        }
        if (containsIgnoreCase(text, "connection reset")) {
            return NetworkError.CONNECTION_RESET;
        }
        if (containsIgnoreCase(text, "unknownhost") || containsIgnoreCase(text, "unknown host")) {
            return NetworkError.HOST_NOT_FOUND;
        }
        if (containsIgnoreCase(text, "no route to host")) {
            return NetworkError.HOST_UNREACHABLE;
        }
        return null;
    }

    private static boolean mentions(LDAPException e, String fragment) {
        return containsIgnoreCase(e.getDiagnosticMessage(), fragment) || containsIgnoreCase(e.getMessage(), fragment);
    }

    private static boolean containsIgnoreCase(String text, String fragment) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(fragment);
    }
}
