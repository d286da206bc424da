package com.vexen.core;

import com.vexen.authentication.SigningAlgorithm;
import com.vexen.observability.SecretRedactor;

/**
 * Settings shared by every subsystem of a {@link VexenContainer}.
 * <p>
 * Construction never fails: the connection string and secret are checked by the subsystems that
 * use them, during {@link VexenContainer#init()}.
 *
 * @param databaseUrl               JDBC connection URL
 * @param secretKey                 HMAC key for token signing
 * @param algorithm                 token signing algorithm
 * @param echo                      log every SQL statement
 * @param poolSize                  connections kept open while idle
 * @param maxOverflow               additional connections under load
 * @param accessTokenExpiresMinutes access-token lifetime in minutes
 * @param refreshTokenExpiresDays   refresh-token lifetime in days
 */
public record VexenConfig(
        String databaseUrl,
        String secretKey,
        SigningAlgorithm algorithm,
        boolean echo,
        int poolSize,
        int maxOverflow,
        int accessTokenExpiresMinutes,
        int refreshTokenExpiresDays) {

    public static final SigningAlgorithm DEFAULT_ALGORITHM = SigningAlgorithm.HS256;
    public static final int DEFAULT_POOL_SIZE = 5;
    public static final int DEFAULT_MAX_OVERFLOW = 10;
    public static final int DEFAULT_ACCESS_TOKEN_EXPIRES_MINUTES = 15;
    public static final int DEFAULT_REFRESH_TOKEN_EXPIRES_DAYS = 30;

    public VexenConfig(String databaseUrl, String secretKey) {
        this(databaseUrl, secretKey, DEFAULT_ALGORITHM, false, DEFAULT_POOL_SIZE, DEFAULT_MAX_OVERFLOW,
                DEFAULT_ACCESS_TOKEN_EXPIRES_MINUTES, DEFAULT_REFRESH_TOKEN_EXPIRES_DAYS);
    }

    public static Builder builder(String databaseUrl, String secretKey) {
        return new Builder(databaseUrl, secretKey);
    }

    @Override
    public String toString() {
        return "VexenConfig[databaseUrl=" + SecretRedactor.maskConnectionString(databaseUrl)
                + ", secretKey=" + SecretRedactor.mask(secretKey)
                + ", algorithm=" + algorithm
                + ", echo=" + echo
                + ", poolSize=" + poolSize
                + ", maxOverflow=" + maxOverflow
                + ", accessTokenExpiresMinutes=" + accessTokenExpiresMinutes
                + ", refreshTokenExpiresDays=" + refreshTokenExpiresDays + "]";
    }

    /**
     * Fluent construction starting from the defaults.
     */
    public static final class Builder {

        private final String databaseUrl;
        private final String secretKey;
        private SigningAlgorithm algorithm = DEFAULT_ALGORITHM;
        private boolean echo;
        private int poolSize = DEFAULT_POOL_SIZE;
        private int maxOverflow = DEFAULT_MAX_OVERFLOW;
        private int accessTokenExpiresMinutes = DEFAULT_ACCESS_TOKEN_EXPIRES_MINUTES;
        private int refreshTokenExpiresDays = DEFAULT_REFRESH_TOKEN_EXPIRES_DAYS;

        private Builder(String databaseUrl, String secretKey) {
            this.databaseUrl = databaseUrl;
            this.secretKey = secretKey;
        }

        public Builder algorithm(SigningAlgorithm algorithm) {
            this.algorithm = algorithm;
            return this;
        }

        public Builder echo(boolean echo) {
            this.echo = echo;
            return this;
        }

        public Builder poolSize(int poolSize) {
            this.poolSize = poolSize;
            return this;
        }

        public Builder maxOverflow(int maxOverflow) {
            this.maxOverflow = maxOverflow;
            return this;
        }

        public Builder accessTokenExpiresMinutes(int minutes) {
            this.accessTokenExpiresMinutes = minutes;
            return this;
        }

        public Builder refreshTokenExpiresDays(int days) {
            this.refreshTokenExpiresDays = days;
            return this;
        }

        public VexenConfig build() {
            return new VexenConfig(databaseUrl, secretKey, algorithm, echo, poolSize, maxOverflow,
                    accessTokenExpiresMinutes, refreshTokenExpiresDays);
        }
    }
}
