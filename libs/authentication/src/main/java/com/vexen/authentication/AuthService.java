package com.vexen.authentication;

import com.vexen.identity.Emails;
import com.vexen.identity.IdentityLookup;
import com.vexen.identity.User;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Credential registration, login and token handling.
 * <p>
 * Identities are owned by the identity subsystem and read through {@link IdentityLookup} on every
 * call, so deactivating a user takes effect immediately, even for tokens already issued.
 */
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    public static final int MIN_PASSWORD_LENGTH = 8;

    private final CredentialStore credentials;
    private final IdentityLookup identities;
    private final PasswordHasher hasher;
    private final TokenIssuer tokens;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final Clock clock;

    AuthService(CredentialStore credentials, IdentityLookup identities, PasswordHasher hasher, TokenIssuer tokens,
                Duration accessTokenTtl, Duration refreshTokenTtl, Clock clock) {
        this.credentials = credentials;
        this.identities = identities;
        this.hasher = hasher;
        this.tokens = tokens;
        this.accessTokenTtl = accessTokenTtl;
        this.refreshTokenTtl = refreshTokenTtl;
        this.clock = clock;
    }

    /**
     * Stores a password for an existing, active identity.
     *
     * @throws IllegalArgumentException if a field is missing or the password is too short
     * @throws AuthenticationException  {@code UNKNOWN_IDENTITY} if there is no identity with that id and
     *                                  email, {@code INACTIVE_IDENTITY} if it is deactivated,
     *                                  {@code ALREADY_REGISTERED} if it already has a credential
     */
    public Credential register(RegisterRequest request) {
        if (request == null || request.userId() == null) {
            throw new IllegalArgumentException("userId must not be null");
        }
        String email = Emails.normalize(request.email());
        if (email == null || email.isEmpty()) {
            throw new IllegalArgumentException("email must not be blank");
        }
        requirePassword(request.password());

        User user = identities.findById(request.userId())
                .filter(u -> u.email().equals(email))
                .orElseThrow(() -> new AuthenticationException(AuthenticationException.Reason.UNKNOWN_IDENTITY,
                        "No identity " + request.userId() + " with email " + email));
        requireActive(user);
        if (credentials.findByUserId(user.id()).isPresent() || credentials.findByEmail(email).isPresent()) {
            throw new AuthenticationException(AuthenticationException.Reason.ALREADY_REGISTERED,
                    "Credential already registered for " + email);
        }

        Credential credential = new Credential(user.id(), email, hasher.hash(request.password()), clock.instant(), null);
        credentials.insert(credential);
        log.info("Registered credential for user {}", user.id());
        return credential;
    }

    /**
     * Verifies email and password and issues a token pair.
     *
     * @throws AuthenticationException {@code INVALID_CREDENTIALS} for an unknown email or wrong
     *                                 password, {@code INACTIVE_IDENTITY} or {@code UNKNOWN_IDENTITY}
     *                                 when the identity no longer allows login
     */
    public TokenPair login(LoginRequest request) {
        if (request == null) {
            throw invalidCredentials();
        }
        String email = Emails.normalize(request.email());
        Credential credential = email == null ? null : credentials.findByEmail(email).orElse(null);
        if (credential == null || !hasher.verify(request.password(), credential.passwordHash())) {
            log.debug("Login refused");
            throw invalidCredentials();
        }
        User user = activeIdentity(credential.userId());
        credentials.recordLogin(user.id(), clock.instant());
        log.debug("User {} logged in", user.id());
        return issuePair(user.id(), credential.email());
    }

    /**
     * Exchanges a valid refresh token for a new token pair.
     *
     * @throws AuthenticationException {@code INVALID_TOKEN}, {@code EXPIRED_TOKEN}, or an identity reason
     */
    public TokenPair refresh(String refreshToken) {
        TokenClaims claims = tokens.verify(refreshToken, TokenType.REFRESH);
        UUID userId = claims.userId();
        Credential credential = credentials.findByUserId(userId)
                .orElseThrow(() -> new AuthenticationException(AuthenticationException.Reason.INVALID_TOKEN,
                        "No credential for token subject " + userId));
        activeIdentity(userId);
        return issuePair(userId, credential.email());
    }

    /**
     * Resolves a valid access token to the identity it was issued for.
     *
     * @throws AuthenticationException {@code INVALID_TOKEN}, {@code EXPIRED_TOKEN}, or an identity reason
     */
    public AuthenticatedUser authenticate(String accessToken) {
        TokenClaims claims = tokens.verify(accessToken, TokenType.ACCESS);
        User user = activeIdentity(claims.userId());
        return new AuthenticatedUser(user.id(), user.email(), user.name());
    }

    /**
     * Replaces the password after checking the current one.
     *
     * @throws AuthenticationException {@code INVALID_CREDENTIALS} if there is no credential or the
     *                                 current password is wrong
     */
    public void changePassword(UUID userId, String currentPassword, String newPassword) {
        requirePassword(newPassword);
        Credential credential = userId == null ? null : credentials.findByUserId(userId).orElse(null);
        if (credential == null || !hasher.verify(currentPassword, credential.passwordHash())) {
            throw invalidCredentials();
        }
        credentials.updatePassword(userId, hasher.hash(newPassword));
        log.info("Password changed for user {}", userId);
    }

    /**
     * Removes the credential of a user. Tokens already issued stop working at their next check.
     *
     * @return true if a credential was removed
     */
    public boolean unregister(UUID userId) {
        if (userId == null) {
            return false;
        }
        boolean removed = credentials.delete(userId);
        if (removed) {
            log.info("Removed credential for user {}", userId);
        }
        return removed;
    }

    private TokenPair issuePair(UUID userId, String email) {
        Instant now = clock.instant();
        TokenClaims access = TokenClaims.of(userId, email, TokenType.ACCESS, now, accessTokenTtl);
        TokenClaims refresh = TokenClaims.of(userId, email, TokenType.REFRESH, now, refreshTokenTtl);
        return new TokenPair(tokens.issue(access), tokens.issue(refresh), userId, access.expiry(), refresh.expiry());
    }

    private User activeIdentity(UUID userId) {
        User user = identities.findById(userId)
                .orElseThrow(() -> new AuthenticationException(AuthenticationException.Reason.UNKNOWN_IDENTITY,
                        "Identity no longer exists: " + userId));
        requireActive(user);
        return user;
    }

    private static void requireActive(User user) {
        if (!user.active()) {
            throw new AuthenticationException(AuthenticationException.Reason.INACTIVE_IDENTITY,
                    "Identity is deactivated: " + user.id());
        }
    }

    private static void requirePassword(String password) {
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw new IllegalArgumentException("password must have at least " + MIN_PASSWORD_LENGTH + " characters");
        }
    }

    private static AuthenticationException invalidCredentials() {
        return new AuthenticationException(AuthenticationException.Reason.INVALID_CREDENTIALS,
                "Invalid email or password");
    }
}
