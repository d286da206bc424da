package com.vexen.authentication;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.vexen.identity.IdentityLookup;
import com.vexen.identity.User;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AuthService")
class AuthServiceTest {

    private static final Instant START = Instant.parse("2026-03-01T08:00:00Z");
    private static final String PASSWORD = "s3cret-pass";

    private final MutableClock clock = new MutableClock(START);
    private final IdentityLookup identities = mock(IdentityLookup.class);
    private final User ada = user("ada@example.com", true);

    private JdbcAuthenticationSystem authentication;
    private AuthService auth;

    @BeforeEach
    void setUp() {
        when(identities.findById(ada.id())).thenReturn(Optional.of(ada));
        AuthenticationConfig config = new AuthenticationConfig(
                "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
                "unit-test-secret",
                SigningAlgorithm.HS256,
                Duration.ofMinutes(15),
                Duration.ofDays(30),
                identities);
        authentication = new JdbcAuthenticationSystem(config, new PasswordHasher(1_000), clock);
        authentication.init();
        auth = authentication.service();
    }

    @AfterEach
    void tearDown() {
        authentication.close();
    }

    private static User user(String email, boolean active) {
        return new User(UUID.randomUUID(), email, "Ada", active, START, START);
    }

    private static void assertReason(ThrowingCallable call, AuthenticationException.Reason reason) {
        assertThatThrownBy(call)
                .isInstanceOfSatisfying(AuthenticationException.class, e -> assertThat(e.reason()).isEqualTo(reason));
    }

    @Nested
    @DisplayName("register()")
    class Register {

        @Test
        @DisplayName("stores a hashed credential for an active identity")
        void registers() {
            Credential credential = auth.register(new RegisterRequest(ada.id(), " ADA@example.com ", PASSWORD));

            assertThat(credential.userId()).isEqualTo(ada.id());
            assertThat(credential.email()).isEqualTo("ada@example.com");
            assertThat(credential.passwordHash()).startsWith("pbkdf2-sha256$").doesNotContain(PASSWORD);
            assertThat(credential.createdAt()).isEqualTo(START);
            assertThat(credential.toString()).doesNotContain(credential.passwordHash());
        }

        @Test
        @DisplayName("an unknown identity is UNKNOWN_IDENTITY")
        void unknownIdentity() {
            assertReason(() -> auth.register(new RegisterRequest(UUID.randomUUID(), "ada@example.com", PASSWORD)),
                    AuthenticationException.Reason.UNKNOWN_IDENTITY);
        }

        @Test
        @DisplayName("an email that does not belong to the identity is UNKNOWN_IDENTITY")
        void emailMismatch() {
            assertReason(() -> auth.register(new RegisterRequest(ada.id(), "eve@example.com", PASSWORD)),
                    AuthenticationException.Reason.UNKNOWN_IDENTITY);
        }

        @Test
        @DisplayName("an inactive identity is INACTIVE_IDENTITY")
        void inactive() {
            User grace = user("grace@example.com", false);
            when(identities.findById(grace.id())).thenReturn(Optional.of(grace));

            assertReason(() -> auth.register(new RegisterRequest(grace.id(), "grace@example.com", PASSWORD)),
                    AuthenticationException.Reason.INACTIVE_IDENTITY);
        }

        @Test
        @DisplayName("a second registration is ALREADY_REGISTERED")
        void twice() {
            auth.register(new RegisterRequest(ada.id(), "ada@example.com", PASSWORD));

            assertReason(() -> auth.register(new RegisterRequest(ada.id(), "ada@example.com", "another-pass")),
                    AuthenticationException.Reason.ALREADY_REGISTERED);
        }

        @Test
        @DisplayName("short passwords are rejected")
        void shortPassword() {
            assertThatThrownBy(() -> auth.register(new RegisterRequest(ada.id(), "ada@example.com", "short")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("8");
        }
    }

    @Nested
    @DisplayName("login and tokens")
    class LoginAndTokens {

        @BeforeEach
        void register() {
            auth.register(new RegisterRequest(ada.id(), "ada@example.com", PASSWORD));
        }

        @Test
        @DisplayName("login() issues a token pair with the configured lifetimes")
        void login() {
            TokenPair pair = auth.login(new LoginRequest("Ada@Example.com", PASSWORD));

            assertThat(pair.userId()).isEqualTo(ada.id());
            assertThat(pair.accessExpiresAt()).isEqualTo(START.plus(Duration.ofMinutes(15)));
            assertThat(pair.refreshExpiresAt()).isEqualTo(START.plus(Duration.ofDays(30)));
            assertThat(pair.accessToken()).isNotEqualTo(pair.refreshToken());
        }

        @Test
        @DisplayName("a wrong password or unknown email is INVALID_CREDENTIALS")
        void wrongPassword() {
            assertReason(() -> auth.login(new LoginRequest("ada@example.com", "not-the-password")),
                    AuthenticationException.Reason.INVALID_CREDENTIALS);
            assertReason(() -> auth.login(new LoginRequest("nobody@example.com", PASSWORD)),
                    AuthenticationException.Reason.INVALID_CREDENTIALS);
        }

        @Test
        @DisplayName("authenticate() resolves an access token to the identity")
        void authenticate() {
            TokenPair pair = auth.login(new LoginRequest("ada@example.com", PASSWORD));

            AuthenticatedUser user = auth.authenticate(pair.accessToken());

            assertThat(user).isEqualTo(new AuthenticatedUser(ada.id(), "ada@example.com", "Ada"));
        }

        @Test
        @DisplayName("a refresh token is not accepted as an access token")
        void refreshTokenIsNotAccess() {
            TokenPair pair = auth.login(new LoginRequest("ada@example.com", PASSWORD));

            assertReason(() -> auth.authenticate(pair.refreshToken()), AuthenticationException.Reason.INVALID_TOKEN);
        }

        @Test
        @DisplayName("access tokens expire, refresh() issues a fresh pair")
        void refresh() {
            TokenPair pair = auth.login(new LoginRequest("ada@example.com", PASSWORD));
            clock.advance(Duration.ofMinutes(20));

            assertReason(() -> auth.authenticate(pair.accessToken()), AuthenticationException.Reason.EXPIRED_TOKEN);

            TokenPair renewed = auth.refresh(pair.refreshToken());
            assertThat(renewed.accessExpiresAt()).isEqualTo(START.plus(Duration.ofMinutes(35)));
            assertThat(auth.authenticate(renewed.accessToken()).userId()).isEqualTo(ada.id());
        }

        @Test
        @DisplayName("deactivation takes effect for tokens already issued")
        void deactivated() {
            TokenPair pair = auth.login(new LoginRequest("ada@example.com", PASSWORD));
            User inactive = new User(ada.id(), ada.email(), ada.name(), false, START, START);
            when(identities.findById(ada.id())).thenReturn(Optional.of(inactive));

            assertReason(() -> auth.authenticate(pair.accessToken()), AuthenticationException.Reason.INACTIVE_IDENTITY);
            assertReason(() -> auth.refresh(pair.refreshToken()), AuthenticationException.Reason.INACTIVE_IDENTITY);
            assertReason(() -> auth.login(new LoginRequest("ada@example.com", PASSWORD)),
                    AuthenticationException.Reason.INACTIVE_IDENTITY);
        }

        @Test
        @DisplayName("unregister() invalidates refresh tokens and logins")
        void unregister() {
            TokenPair pair = auth.login(new LoginRequest("ada@example.com", PASSWORD));

            assertThat(auth.unregister(ada.id())).isTrue();
            assertThat(auth.unregister(ada.id())).isFalse();

            assertReason(() -> auth.refresh(pair.refreshToken()), AuthenticationException.Reason.INVALID_TOKEN);
            assertReason(() -> auth.login(new LoginRequest("ada@example.com", PASSWORD)),
                    AuthenticationException.Reason.INVALID_CREDENTIALS);
        }

        @Test
        @DisplayName("changePassword() requires the current password")
        void changePassword() {
            assertReason(() -> auth.changePassword(ada.id(), "not-the-password", "brand-new-pass"),
                    AuthenticationException.Reason.INVALID_CREDENTIALS);

            auth.changePassword(ada.id(), PASSWORD, "brand-new-pass");

            assertReason(() -> auth.login(new LoginRequest("ada@example.com", PASSWORD)),
                    AuthenticationException.Reason.INVALID_CREDENTIALS);
            assertThat(auth.login(new LoginRequest("ada@example.com", "brand-new-pass")).userId()).isEqualTo(ada.id());
        }
    }
}
