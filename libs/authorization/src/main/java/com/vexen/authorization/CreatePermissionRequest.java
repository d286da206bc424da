package com.vexen.authorization;

/**
 * Input for {@link PermissionService#create(CreatePermissionRequest)}.
 */
public record CreatePermissionRequest(String name, String description) {}
