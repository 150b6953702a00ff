package adsentry.core.service.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import adsentry.core.model.auth.LoginOutcome;
import adsentry.core.model.auth.LoginRequest;
import adsentry.core.model.directory.UserAccountControl;
import adsentry.core.model.directory.UsernameFormat;
import adsentry.core.model.lockout.FailedLoginAttempt;
import adsentry.core.model.lockout.LockoutStatus;
import adsentry.core.model.lockout.LoginErrorType;
import adsentry.core.port.in.DirectoryLogin;
import adsentry.core.port.in.LockoutManagement;
import adsentry.core.port.out.DirectoryClient;

/**
 * Directory login guarded by the lockout engine.
 *
 * <p>Flow:
 * <ol>
 *   <li>A locked account is refused before its credentials are checked</li>
 *   <li>The password is verified with a directory bind</li>
 *   <li>The user's entry is read; a missing or disabled entry fails the login</li>
 *   <li>Failures are recorded; a success clears the recent failures</li>
 * </ol>
 *
 * <p>Lockout state is tracked under {@link UsernameFormat#accountKey(String)}, so every
 * spelling of one directory account shares a single attempt counter.
 */
@ApplicationScoped
public class DirectoryLoginService implements DirectoryLogin {

    private static final Logger LOG = Logger.getLogger(DirectoryLoginService.class);

    static final String AUTH_SOURCE = "ad";

    private final DirectoryClient directory;
    private final LockoutManagement lockout;

    @Inject
    public DirectoryLoginService(DirectoryClient directory, LockoutManagement lockout) {
        this.directory = directory;
        this.lockout = lockout;
    }

    @Override
    public Uni<LoginOutcome> login(LoginRequest request) {
        final var username = request.username();
        LOG.infof("Authentication attempt: %s via %s", username, AUTH_SOURCE);

        return lockout.checkLockoutStatus(UsernameFormat.accountKey(username), request.ipAddress())
                .chain(status -> {
                    if (status.isLocked()) {
                        LOG.infof("Login refused for %s: account locked until %s", username, status.lockoutExpiresAt());
                        return Uni.createFrom().<LoginOutcome>item(new LoginOutcome.Locked(status));
                    }
                    return verify(request);
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.errorv(error, "Login of {0} failed unexpectedly", username);
                    return new LoginOutcome.Failed(LoginErrorType.SERVICE_ERROR, LockoutStatus.unlocked(0));
                });
    }

    private Uni<LoginOutcome> verify(LoginRequest request) {
        final var username = request.username();
        return directory.authenticate(username, request.password())
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.errorv(error, "Directory authentication of {0} failed", username);
                    return null;
                })
                .chain(authenticated -> {
                    if (authenticated == null) {
                        return fail(request, LoginErrorType.SERVICE_ERROR);
                    }
                    if (!authenticated) {
                        return fail(request, LoginErrorType.INVALID_CREDENTIALS);
                    }
                    return directory.getUser(username).chain(user -> {
                        if (user.isEmpty()) {
                            return fail(request, LoginErrorType.USER_NOT_FOUND);
                        }
                        if (UserAccountControl.isDisabled(user.get())) {
                            return fail(request, LoginErrorType.USER_INACTIVE);
                        }
                        LOG.infof("Login succeeded for %s", username);
                        final LoginOutcome outcome = new LoginOutcome.Authenticated(user.get());
                        return lockout.clearFailedAttempts(UsernameFormat.accountKey(username), request.ipAddress())
                                .replaceWith(outcome);
                    });
                });
    }

    private Uni<LoginOutcome> fail(LoginRequest request, LoginErrorType errorType) {
        LOG.warnf("Authentication failed for user: %s, error: %s", request.username(), errorType.value());
        final var account = UsernameFormat.accountKey(request.username());
        final var attempt =
                FailedLoginAttempt.of(account, request.ipAddress(), request.userAgent(), AUTH_SOURCE, errorType);
        return lockout.recordFailedAttempt(attempt)
                .map(status -> (LoginOutcome) new LoginOutcome.Failed(errorType, status));
    }
}
