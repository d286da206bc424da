package com.vexen.autoconfigure;

import com.vexen.authentication.SigningAlgorithm;
import com.vexen.core.VexenConfig;
import com.vexen.observability.SecretRedactor;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Container settings bound from the {@code vexen.*} prefix:
 *
 * <pre>
 * vexen:
 *   database-url: jdbc:postgresql://db:5432/vexen?user=vexen&amp;password=...
 *   secret-key: ${VEXEN_SECRET_KEY}
 *   algorithm: HS256
 *   echo: false
 *   pool-size: 5
 *   max-overflow: 10
 *   access-token-expires-minutes: 15
 *   refresh-token-expires-days: 30
 * </pre>
 *
 * Unset optional fields take the {@link VexenConfig} defaults; the compact constructor applies
 * them before Bean Validation runs.
 */
@ConfigurationProperties(prefix = "vexen")
@Validated
public record VexenProperties(
        @NotBlank String databaseUrl,
        @NotBlank String secretKey,
        SigningAlgorithm algorithm,
        boolean echo,
        @Min(1) Integer poolSize,
        @Min(0) Integer maxOverflow,
        @Min(1) Integer accessTokenExpiresMinutes,
        @Min(1) Integer refreshTokenExpiresDays) {

    public VexenProperties {
        if (algorithm == null) {
            algorithm = VexenConfig.DEFAULT_ALGORITHM;
        }
        if (poolSize == null) {
            poolSize = VexenConfig.DEFAULT_POOL_SIZE;
        }
        if (maxOverflow == null) {
            maxOverflow = VexenConfig.DEFAULT_MAX_OVERFLOW;
        }
        if (accessTokenExpiresMinutes == null) {
            accessTokenExpiresMinutes = VexenConfig.DEFAULT_ACCESS_TOKEN_EXPIRES_MINUTES;
        }
        if (refreshTokenExpiresDays == null) {
            refreshTokenExpiresDays = VexenConfig.DEFAULT_REFRESH_TOKEN_EXPIRES_DAYS;
        }
    }

    public VexenConfig toConfig() {
        return new VexenConfig(databaseUrl, secretKey, algorithm, echo, poolSize, maxOverflow,
                accessTokenExpiresMinutes, refreshTokenExpiresDays);
    }

    @Override
    public String toString() {
        return "VexenProperties[databaseUrl=" + SecretRedactor.maskConnectionString(databaseUrl)
                + ", secretKey=" + SecretRedactor.mask(secretKey)
                + ", algorithm=" + algorithm
                + ", echo=" + echo
                + ", poolSize=" + poolSize
                + ", maxOverflow=" + maxOverflow
                + ", accessTokenExpiresMinutes=" + accessTokenExpiresMinutes
                + ", refreshTokenExpiresDays=" + refreshTokenExpiresDays + "]";
    }
}
