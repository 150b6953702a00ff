package adsentry.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import adsentry.adapter.out.storage.memory.InMemoryAttemptCache;
import adsentry.adapter.out.storage.memory.InMemoryAttemptStore;
import adsentry.core.config.LockoutConfig;
import adsentry.core.model.auth.LoginOutcome;
import adsentry.core.model.auth.LoginRequest;
import adsentry.core.model.directory.DirectoryEntry;
import adsentry.core.model.lockout.FailedLoginAttempt;
import adsentry.core.model.lockout.LockoutStatus;
import adsentry.core.model.lockout.LoginErrorType;
import adsentry.core.port.in.LockoutManagement;
import adsentry.core.port.out.DirectoryClient;
import adsentry.core.port.out.SecurityMetrics;
import adsentry.core.service.lockout.LockoutEngine;

@DisplayName("DirectoryLoginService")
@ExtendWith(MockitoExtension.class)
class DirectoryLoginServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final String IP = "10.0.0.5";

    @Mock
    private DirectoryClient directory;

    @Mock
    private LockoutManagement lockout;

    private DirectoryLoginService service;

    @BeforeEach
    void setUp() {
        service = new DirectoryLoginService(directory, lockout);
    }

    private static LoginRequest request(String username, String password) {
        return new LoginRequest(username, password, IP, "curl/8.0");
    }

    private static DirectoryEntry user(String userAccountControl) {
        return new DirectoryEntry(
                "CN=John Doe,OU=Users,DC=corp,DC=example,DC=com",
                Map.of("sAMAccountName", List.of("jdoe"), "userAccountControl", List.of(userAccountControl)));
    }

    private void notLocked() {
        when(lockout.checkLockoutStatus("jdoe", IP)).thenReturn(Uni.createFrom().item(LockoutStatus.unlocked(0)));
    }

    private void recordsAttempts(LockoutStatus after) {
        when(lockout.recordFailedAttempt(any())).thenReturn(Uni.createFrom().item(after));
    }

    private LoginOutcome login(LoginRequest request) {
        return service.login(request).await().atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("login()")
    class LoginTests {

        @Test
        @DisplayName("should authenticate an enabled user and clear failures")
        void shouldAuthenticate() {
            final var entry = user("512");
            notLocked();
            when(directory.authenticate("jdoe", "secret")).thenReturn(Uni.createFrom().item(true));
            when(directory.getUser("jdoe")).thenReturn(Uni.createFrom().item(Optional.of(entry)));
            when(lockout.clearFailedAttempts("jdoe", IP)).thenReturn(Uni.createFrom().voidItem());

            final var outcome = login(request(" jdoe ", "secret"));

            final var authenticated = assertInstanceOf(LoginOutcome.Authenticated.class, outcome);
            assertSame(entry, authenticated.user());
            verify(lockout, never()).recordFailedAttempt(any());
        }

        @Test
        @DisplayName("should refuse a locked account without checking credentials")
        void shouldRefuseLockedAccount() {
            final var status = LockoutStatus.locked(Instant.now().plus(Duration.ofMinutes(10)), "locked", 5);
            when(lockout.checkLockoutStatus("jdoe", IP)).thenReturn(Uni.createFrom().item(status));

            final var outcome = login(request("jdoe", "secret"));

            final var locked = assertInstanceOf(LoginOutcome.Locked.class, outcome);
            assertTrue(locked.retryAfter().toMinutes() >= 9);
            verify(directory, never()).authenticate(anyString(), anyString());
            verify(lockout, never()).recordFailedAttempt(any());
        }

        @Test
        @DisplayName("should record invalid credentials")
        void shouldRecordInvalidCredentials() {
            notLocked();
            when(directory.authenticate("jdoe", "wrong")).thenReturn(Uni.createFrom().item(false));
            recordsAttempts(LockoutStatus.unlocked(3));

            final var outcome = login(request("jdoe", "wrong"));

            final var failed = assertInstanceOf(LoginOutcome.Failed.class, outcome);
            assertEquals(LoginErrorType.INVALID_CREDENTIALS, failed.errorType());
            assertEquals(3, failed.status().failedAttempts());

            final var captor = ArgumentCaptor.forClass(FailedLoginAttempt.class);
            verify(lockout).recordFailedAttempt(captor.capture());
            assertEquals("jdoe", captor.getValue().username());
            assertEquals(IP, captor.getValue().ipAddress());
            assertEquals("curl/8.0", captor.getValue().userAgent());
            assertEquals(DirectoryLoginService.AUTH_SOURCE, captor.getValue().authSource());
        }

        @Test
        @DisplayName("should report the lockout caused by this attempt")
        void shouldReportNewLockout() {
            final var locked = LockoutStatus.locked(Instant.now().plus(Duration.ofMinutes(15)), "locked", 5);
            notLocked();
            when(directory.authenticate("jdoe", "wrong")).thenReturn(Uni.createFrom().item(false));
            recordsAttempts(locked);

            final var failed = assertInstanceOf(LoginOutcome.Failed.class, login(request("jdoe", "wrong")));

            assertTrue(failed.status().isLocked());
        }

        @Test
        @DisplayName("should fail with user_not_found when the entry is missing")
        void shouldFailWhenUserMissing() {
            notLocked();
            when(directory.authenticate("jdoe", "secret")).thenReturn(Uni.createFrom().item(true));
            when(directory.getUser("jdoe")).thenReturn(Uni.createFrom().item(Optional.empty()));
            recordsAttempts(LockoutStatus.unlocked(1));

            final var failed = assertInstanceOf(LoginOutcome.Failed.class, login(request("jdoe", "secret")));

            assertEquals(LoginErrorType.USER_NOT_FOUND, failed.errorType());
        }

        @Test
        @DisplayName("should fail with user_inactive for a disabled account")
        void shouldFailForDisabledAccount() {
            notLocked();
            when(directory.authenticate("jdoe", "secret")).thenReturn(Uni.createFrom().item(true));
            when(directory.getUser("jdoe")).thenReturn(Uni.createFrom().item(Optional.of(user("514"))));
            recordsAttempts(LockoutStatus.unlocked(1));

            final var failed = assertInstanceOf(LoginOutcome.Failed.class, login(request("jdoe", "secret")));

            assertEquals(LoginErrorType.USER_INACTIVE, failed.errorType());
            verify(lockout, never()).clearFailedAttempts(anyString(), any());
        }

        @Test
        @DisplayName("should record a service error when the directory fails")
        void shouldRecordServiceError() {
            notLocked();
            when(directory.authenticate("jdoe", "secret"))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("pool closed")));
            recordsAttempts(LockoutStatus.unlocked(1));

            final var failed = assertInstanceOf(LoginOutcome.Failed.class, login(request("jdoe", "secret")));

            assertEquals(LoginErrorType.SERVICE_ERROR, failed.errorType());
        }

        @Test
        @DisplayName("should fail with a service error when lockout tracking fails")
        void shouldFailWhenLockoutFails() {
            when(lockout.checkLockoutStatus("jdoe", IP))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("unexpected")));

            final var failed = assertInstanceOf(LoginOutcome.Failed.class, login(request("jdoe", "secret")));

            assertEquals(LoginErrorType.SERVICE_ERROR, failed.errorType());
            assertEquals(LockoutStatus.unlocked(0), failed.status());
        }
    }

    @Nested
    @DisplayName("account key")
    class AccountKeyTests {

        @Test
        @DisplayName("should track a domain-qualified name under its account name")
        void shouldTrackCanonicalAccount() {
            notLocked();
            when(directory.authenticate("CORP\\JDoe", "wrong")).thenReturn(Uni.createFrom().item(false));
            recordsAttempts(LockoutStatus.unlocked(1));

            login(request("CORP\\JDoe", "wrong"));

            final var captor = ArgumentCaptor.forClass(FailedLoginAttempt.class);
            verify(lockout).recordFailedAttempt(captor.capture());
            assertEquals("jdoe", captor.getValue().username());
        }

        @Test
        @DisplayName("should lock the account when failures use different spellings of its name")
        void shouldLockAcrossSpellings() {
            final var config = mock(LockoutConfig.class);
            when(config.enabled()).thenReturn(true);
            when(config.maxFailedAttempts()).thenReturn(5);
            when(config.attemptWindow()).thenReturn(Duration.ofMinutes(15));
            when(config.lockoutDurations()).thenReturn(List.of(Duration.ofMinutes(15)));
            when(config.maxLockoutDuration()).thenReturn(Duration.ofHours(1));
            final var cache = new InMemoryAttemptCache();
            final var engine =
                    new LockoutEngine(config, new InMemoryAttemptStore(), cache, mock(SecurityMetrics.class));
            final var guarded = new DirectoryLoginService(directory, engine);
            when(directory.authenticate(anyString(), eq("wrong"))).thenReturn(Uni.createFrom().item(false));

            try {
                for (final var name : List.of("jdoe", "JDOE", "CORP\\jdoe", "jdoe@corp.example.com", "X\\jdoe")) {
                    guarded.login(request(name, "wrong")).await().atMost(TIMEOUT);
                }

                final var outcome = guarded.login(request("jdoe", "correct-horse")).await().atMost(TIMEOUT);

                assertInstanceOf(LoginOutcome.Locked.class, outcome);
                assertTrue(engine.checkLockoutStatus("jdoe", IP).await().atMost(TIMEOUT).isLocked());
                verify(directory, never()).authenticate(anyString(), eq("correct-horse"));
            } finally {
                cache.shutdown();
            }
        }
    }

    @Test
    @DisplayName("LoginRequest should not expose the password")
    void requestShouldHidePassword() {
        assertTrue(!request("jdoe", "hunter2").toString().contains("hunter2"));
    }
}
