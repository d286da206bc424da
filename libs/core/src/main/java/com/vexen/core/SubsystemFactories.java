package com.vexen.core;

import com.vexen.authentication.AuthenticationConfig;
import com.vexen.authentication.AuthenticationSystem;
import com.vexen.authentication.JdbcAuthenticationSystem;
import com.vexen.authorization.AuthorizationConfig;
import com.vexen.authorization.AuthorizationSystem;
import com.vexen.authorization.JdbcAuthorizationSystem;
import com.vexen.identity.IdentityConfig;
import com.vexen.identity.IdentitySystem;
import com.vexen.identity.JdbcIdentitySystem;
import com.vexen.lifecycle.SubsystemFactory;

/**
 * How a {@link VexenContainer} constructs its subsystems.
 */
public record SubsystemFactories(
        SubsystemFactory<IdentityConfig, ? extends IdentitySystem> identity,
        SubsystemFactory<AuthorizationConfig, ? extends AuthorizationSystem> authorization,
        SubsystemFactory<AuthenticationConfig, ? extends AuthenticationSystem> authentication) {

    public SubsystemFactories {
        if (identity == null || authorization == null || authentication == null) {
            throw new IllegalArgumentException("All three subsystem factories are required");
        }
    }

    /** JDBC-backed subsystems. */
    public static SubsystemFactories defaults() {
        return new SubsystemFactories(JdbcIdentitySystem::new, JdbcAuthorizationSystem::new, JdbcAuthenticationSystem::new);
    }
}
