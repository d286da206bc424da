package com.vexen.authorization;

import java.util.UUID;

/**
 * A named role. Permissions are granted to roles, roles are assigned to users.
 *
 * @param id          stable identifier
 * @param name        unique role name (e.g., "admin")
 * @param description optional description
 */
public record Role(UUID id, String name, String description) {}
