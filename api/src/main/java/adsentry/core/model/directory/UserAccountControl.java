package adsentry.core.model.directory;

/**
 * Active Directory {@code userAccountControl} flag checks.
 */
public final class UserAccountControl {

    public static final String ATTRIBUTE = "userAccountControl";

    public static final int ACCOUNT_DISABLED = 0x0002;

    private UserAccountControl() {}

    /**
     * Whether the entry's account is disabled. Entries without a parsable
     * {@code userAccountControl} value are treated as enabled.
     */
    public static boolean isDisabled(DirectoryEntry entry) {
        return hasFlag(entry, ACCOUNT_DISABLED);
    }

    private static boolean hasFlag(DirectoryEntry entry, int flag) {
        return entry.firstValue(ATTRIBUTE)
                .map(UserAccountControl::parse)
                .map(value -> (value & flag) != 0)
                .orElse(false);
    }

    private static long parse(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
