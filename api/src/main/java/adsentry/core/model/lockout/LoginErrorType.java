package adsentry.core.model.lockout;

import java.util.Arrays;

/**
 * Why a login attempt failed.
 */
public enum LoginErrorType {
    INVALID_CREDENTIALS("invalid_credentials"),
    ACCOUNT_LOCKED("account_locked"),
    USER_NOT_FOUND("user_not_found"),
    USER_INACTIVE("user_inactive"),
    SERVICE_ERROR("service_error");

    private final String value;

    LoginErrorType(String value) {
        this.value = value;
    }

    /** Stored and reported form, e.g. {@code invalid_credentials}. */
    public String value() {
        return value;
    }

    public static LoginErrorType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown login error type: " + value));
    }
}
