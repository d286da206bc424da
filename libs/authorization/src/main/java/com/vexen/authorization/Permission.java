package com.vexen.authorization;

import java.util.UUID;

/**
 * A named permission (e.g., "users:write").
 *
 * @param id          stable identifier
 * @param name        unique permission name
 * @param description optional description
 */
public record Permission(UUID id, String name, String description) {}
