package com.vexen.core;

import com.vexen.authentication.AuthenticationConfig;
import com.vexen.authorization.AuthorizationConfig;
import com.vexen.identity.IdentityConfig;
import com.vexen.identity.IdentityLookup;
import java.time.Duration;

/**
 * Projections of {@link VexenConfig} onto the settings each subsystem needs.
 */
final class ConfigSlices {

    private ConfigSlices() {
        // utility class
    }

    static IdentityConfig identity(VexenConfig config) {
        return new IdentityConfig(config.databaseUrl(), config.echo(), config.poolSize(), config.maxOverflow());
    }

    static AuthorizationConfig authorization(VexenConfig config) {
        return new AuthorizationConfig(config.databaseUrl(), config.echo(), config.poolSize(), config.maxOverflow());
    }

    /**
     * @param identityLookup read surface of the already initialized identity subsystem
     */
    static AuthenticationConfig authentication(VexenConfig config, IdentityLookup identityLookup) {
        return new AuthenticationConfig(
                config.databaseUrl(),
                config.secretKey(),
                config.algorithm() == null ? VexenConfig.DEFAULT_ALGORITHM : config.algorithm(),
                Duration.ofMinutes(config.accessTokenExpiresMinutes()),
                Duration.ofDays(config.refreshTokenExpiresDays()),
                identityLookup);
    }
}
