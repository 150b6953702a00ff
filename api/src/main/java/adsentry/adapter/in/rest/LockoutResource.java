package adsentry.adapter.in.rest;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.quarkus.security.PermissionsAllowed;
import io.quarkus.security.identity.SecurityIdentity;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import adsentry.adapter.in.problem.LockoutProblem;
import adsentry.core.config.LockoutConfig;
import adsentry.core.model.auth.Permission;
import adsentry.core.model.directory.UsernameFormat;
import adsentry.core.port.in.LockoutManagement;
import adsentry.spi.LockoutStoreException;

/**
 * REST resource for account lockout administration.
 *
 * <p>
 * Provides endpoints for:
 * <ul>
 * <li>Listing currently locked accounts</li>
 * <li>Checking the lockout status of an account</li>
 * <li>Reading an account's lockout history</li>
 * <li>Unlocking an account</li>
 * </ul>
 *
 * <p>Usernames in paths are resolved with {@link UsernameFormat#accountKey(String)}, the
 * key logins are tracked under.
 */
@Path("/admin/lockouts")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class LockoutResource {

    private static final Logger LOG = Logger.getLogger(LockoutResource.class);

    private static final int DEFAULT_LIST_LIMIT = 100;
    private static final int MAX_LIMIT = 1000;

    private final LockoutManagement lockouts;
    private final LockoutConfig config;
    private final SecurityIdentity identity;

    @Inject
    public LockoutResource(LockoutManagement lockouts, LockoutConfig config, SecurityIdentity identity) {
        this.lockouts = lockouts;
        this.config = config;
        this.identity = identity;
    }

    /**
     * List currently locked accounts.
     *
     * @param limit maximum number of entries to return
     * @return newest active lockout per username
     */
    @GET
    @PermissionsAllowed({Permission.LOCKOUTS_READ_VALUE, Permission.ADMIN_VALUE})
    public Uni<Response> listLockouts(@QueryParam("limit") Integer limit) {
        requireEnabled();
        final var effectiveLimit = limit(limit, DEFAULT_LIST_LIMIT);

        return lockouts.listActiveLockouts(effectiveLimit)
                .map(active -> Response.ok(Map.of(
                                "lockouts", active,
                                "count", active.size(),
                                "limit", effectiveLimit))
                        .build())
                .onFailure(LockoutStoreException.class)
                .transform(error -> LockoutProblem.storeUnavailable("Active lockouts are unavailable"));
    }

    /**
     * Get the lockout status of an account.
     *
     * @param username the username
     * @param ip       optional client address
     * @return lockout status
     */
    @GET
    @Path("/users/{username}")
    @PermissionsAllowed({Permission.LOCKOUTS_READ_VALUE, Permission.ADMIN_VALUE})
    public Uni<Response> getLockoutStatus(@PathParam("username") String username, @QueryParam("ip") String ip) {
        requireEnabled();
        final var account = UsernameFormat.accountKey(username);

        return lockouts.checkLockoutStatus(account, ip).map(status -> {
            final var response = new LinkedHashMap<String, Object>();
            response.put("username", account);
            response.put("ipAddress", ip);
            response.put("locked", status.isLocked());
            response.put("failedAttempts", status.failedAttempts());
            response.put("maxAttempts", config.maxFailedAttempts());
            if (status.isLocked()) {
                response.put("lockoutExpiresAt", status.lockoutExpiresAt());
                response.put("lockoutReason", status.lockoutReason());
            }
            response.put("checkedAt", Instant.now().toString());
            return Response.ok(response).build();
        });
    }

    /**
     * Get the lockout history of an account, most recent first.
     *
     * @param username the username
     * @param limit    maximum number of entries to return
     * @return lockout history
     */
    @GET
    @Path("/users/{username}/history")
    @PermissionsAllowed({Permission.LOCKOUTS_READ_VALUE, Permission.ADMIN_VALUE})
    public Uni<Response> getLockoutHistory(@PathParam("username") String username, @QueryParam("limit") Integer limit) {
        requireEnabled();
        final var effectiveLimit = limit(limit, LockoutManagement.DEFAULT_HISTORY_LIMIT);
        final var account = UsernameFormat.accountKey(username);

        return lockouts.getLockoutHistory(account, effectiveLimit)
                .map(history -> Response.ok(Map.of(
                                "username", account,
                                "history", history,
                                "count", history.size()))
                        .build());
    }

    /**
     * Unlock an account and clear its failed login history.
     *
     * @param username the username to unlock
     * @param request  optional request body with reason
     * @return number of lockouts released
     */
    @DELETE
    @Path("/users/{username}")
    @Consumes(MediaType.APPLICATION_JSON)
    @PermissionsAllowed({Permission.LOCKOUTS_WRITE_VALUE, Permission.ADMIN_VALUE})
    public Uni<Response> unlockAccount(@PathParam("username") String username, UnlockRequest request) {
        if (username == null || username.isBlank()) {
            throw LockoutProblem.badRequest("Username is required");
        }

        final var account = UsernameFormat.accountKey(username);
        final var reason = request != null ? request.reason() : null;
        final var unlockedBy = administrator();
        LOG.infof("Unlocking account: username=%s, by=%s, reason=%s", account, unlockedBy, reason);

        return lockouts.unlockAccount(account, unlockedBy, reason)
                .map(released -> Response.ok(Map.of(
                                "username", account,
                                "released", released,
                                "unlockedBy", unlockedBy,
                                "unlockedAt", Instant.now().toString()))
                        .build())
                .onFailure(LockoutStoreException.class)
                .transform(error -> {
                    LOG.errorv(error, "Unlock of {0} failed", account);
                    return LockoutProblem.storeUnavailable("Account %s could not be unlocked".formatted(account));
                });
    }

    private void requireEnabled() {
        if (!config.enabled()) {
            throw LockoutProblem.featureDisabled("Account lockout");
        }
    }

    private String administrator() {
        if (identity == null || identity.isAnonymous() || identity.getPrincipal() == null) {
            return "unknown";
        }
        return identity.getPrincipal().getName();
    }

    private static int limit(Integer requested, int defaultLimit) {
        if (requested == null || requested <= 0) {
            return defaultLimit;
        }
        return Math.min(requested, MAX_LIMIT);
    }

    /**
     * Request body for unlocking an account.
     */
    public record UnlockRequest(String reason) {}
}
