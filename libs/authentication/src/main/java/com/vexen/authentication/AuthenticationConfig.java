package com.vexen.authentication;

import com.vexen.database.DatabaseSettings;
import com.vexen.identity.IdentityLookup;
import com.vexen.observability.SecretRedactor;
import java.time.Duration;

/**
 * Settings the authentication subsystem is created with.
 * <p>
 * The secret key is not checked here; {@link JdbcAuthenticationSystem#init()} rejects a blank one.
 *
 * @param databaseUrl     connection string of the credential store
 * @param secretKey       HMAC key used to sign tokens
 * @param algorithm       token signing algorithm
 * @param accessTokenTtl  lifetime of access tokens
 * @param refreshTokenTtl lifetime of refresh tokens
 * @param identityLookup  live read access to the identity subsystem
 */
public record AuthenticationConfig(
        String databaseUrl,
        String secretKey,
        SigningAlgorithm algorithm,
        Duration accessTokenTtl,
        Duration refreshTokenTtl,
        IdentityLookup identityLookup) {

    public AuthenticationConfig {
        if (algorithm == null) {
            throw new IllegalArgumentException("algorithm must not be null");
        }
        requirePositive("accessTokenTtl", accessTokenTtl);
        requirePositive("refreshTokenTtl", refreshTokenTtl);
        if (identityLookup == null) {
            throw new IllegalArgumentException("identityLookup must not be null");
        }
    }

    /** Pool settings for the credential store; authentication always uses the pool defaults. */
    public DatabaseSettings database() {
        return DatabaseSettings.of(databaseUrl);
    }

    @Override
    public String toString() {
        return "AuthenticationConfig[databaseUrl=" + SecretRedactor.maskConnectionString(databaseUrl)
                + ", secretKey=" + SecretRedactor.mask(secretKey)
                + ", algorithm=" + algorithm
                + ", accessTokenTtl=" + accessTokenTtl
                + ", refreshTokenTtl=" + refreshTokenTtl + "]";
    }

    private static void requirePositive(String field, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(field + " must be positive, got " + value);
        }
    }
}
