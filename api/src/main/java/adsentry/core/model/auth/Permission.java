package adsentry.core.model.auth;

/**
 * Permissions guarding the administrative endpoints.
 *
 * <p>The string constants (e.g., {@link #ADMIN_VALUE}) can be used in annotations
 * that require compile-time string constants.
 */
public enum Permission {

    /** Full administrative access. */
    ADMIN("admin"),

    /** View lockouts and lockout history. */
    LOCKOUTS_READ("lockouts.read"),

    /** Unlock accounts. */
    LOCKOUTS_WRITE("lockouts.write");

    /** Admin permission value. */
    public static final String ADMIN_VALUE = "admin";
    /** Lockouts read permission value. */
    public static final String LOCKOUTS_READ_VALUE = "lockouts.read";
    /** Lockouts write permission value. */
    public static final String LOCKOUTS_WRITE_VALUE = "lockouts.write";

    private final String value;

    Permission(String value) {
        this.value = value;
    }

    /**
     * Get the string value of this permission.
     *
     * @return the permission string
     */
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
