package adsentry.core.model.directory;

import java.util.Locale;
import java.util.Optional;

/**
 * Parsed form of a login name as typed by a user.
 *
 * <p>Three shapes are accepted:
 * <ul>
 *   <li>{@code DOMAIN\jdoe} - down-level logon name, looked up by the part after the backslash</li>
 *   <li>{@code jdoe@corp.example.com} - user principal name, looked up by the local part
 *       or by the full UPN</li>
 *   <li>{@code jdoe} - plain account name</li>
 * </ul>
 *
 * @param kind        which shape the input had
 * @param lookupValue value to match against {@code sAMAccountName}
 * @param upn         full user principal name, only for {@link Kind#UPN}
 */
public record UsernameFormat(Kind kind, String lookupValue, String upn) {

    public enum Kind {
        PLAIN,
        UPN,
        DOMAIN_QUALIFIED
    }

    public UsernameFormat {
        if (kind == null) {
            throw new IllegalArgumentException("Kind cannot be null");
        }
        if (lookupValue == null || lookupValue.isEmpty()) {
            throw new IllegalArgumentException("Lookup value cannot be empty");
        }
        if (kind == Kind.UPN && (upn == null || upn.isEmpty())) {
            throw new IllegalArgumentException("UPN format requires the full principal name");
        }
    }

    /**
     * Parse a login name.
     *
     * <p>A backslash takes precedence over an at-sign, so {@code CORP\j@doe} resolves
     * to the account name {@code j@doe}.
     *
     * @param username the raw login name
     * @return the parsed format
     * @throws IllegalArgumentException if the name is blank or has an empty account part
     */
    public static UsernameFormat parse(String username) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be blank");
        }
        final var trimmed = username.trim();

        final var backslash = trimmed.indexOf('\\');
        if (backslash >= 0) {
            final var account = trimmed.substring(backslash + 1);
            if (account.isEmpty()) {
                throw new IllegalArgumentException("Missing account name after domain: " + trimmed);
            }
            return new UsernameFormat(Kind.DOMAIN_QUALIFIED, account, null);
        }

        final var at = trimmed.indexOf('@');
        if (at >= 0) {
            final var local = trimmed.substring(0, at);
            if (local.isEmpty()) {
                throw new IllegalArgumentException("Missing account name before domain: " + trimmed);
            }
            return new UsernameFormat(Kind.UPN, local, trimmed);
        }

        return new UsernameFormat(Kind.PLAIN, trimmed, null);
    }

    /**
     * Name that identifies the account however it was typed: the lower-cased
     * account name, so {@code CORP\JDoe}, {@code jdoe@corp.example.com} and {@code jdoe}
     * share one key. A name without an account part is lower-cased as a whole.
     *
     * @param username the raw login name
     * @return the canonical account name
     */
    public static String accountKey(String username) {
        final var trimmed = username.trim();
        final var backslash = trimmed.indexOf('\\');
        final var at = trimmed.indexOf('@');
        var account = trimmed;
        if (backslash >= 0) {
            account = trimmed.substring(backslash + 1);
        } else if (at > 0) {
            account = trimmed.substring(0, at);
        }
        return (account.isEmpty() ? trimmed : account).toLowerCase(Locale.ROOT);
    }

    public Optional<String> userPrincipalName() {
        return Optional.ofNullable(upn);
    }
}
