package com.vexen.authorization;

/**
 * Input for {@link RoleService#create(CreateRoleRequest)}.
 */
public record CreateRoleRequest(String name, String description) {}
