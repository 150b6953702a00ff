package adsentry.core.port.in;

import io.smallrye.mutiny.Uni;

import adsentry.core.model.auth.LoginOutcome;
import adsentry.core.model.auth.LoginRequest;

/**
 * Use case interface for logging in with directory credentials.
 */
public interface DirectoryLogin {

    /**
     * Check the lockout status, verify the credentials and update the failed
     * attempt history accordingly.
     *
     * @param request the login request
     * @return Uni with the outcome; never fails
     */
    Uni<LoginOutcome> login(LoginRequest request);
}
