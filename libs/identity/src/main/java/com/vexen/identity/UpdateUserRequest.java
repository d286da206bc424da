package com.vexen.identity;

/**
 * Partial update for {@link UserService#update(java.util.UUID, UpdateUserRequest)}. Null fields
 * are left unchanged.
 *
 * @param name   new display name, or null
 * @param active new active flag, or null
 */
public record UpdateUserRequest(String name, Boolean active) {}
