package com.vexen.authorization;

import com.vexen.lifecycle.Subsystem;

/**
 * Public surface of the authorization subsystem. Each accessor throws
 * {@link IllegalStateException} while the subsystem is not initialized.
 */
public interface AuthorizationSystem extends Subsystem {

    /** Subsystem name used in logs, health and metrics. */
    String NAME = "authorization";

    RoleService roles();

    PermissionService permissions();

    AccessService access();
}
