package com.vexen.identity;

/**
 * Input for {@link UserService#create(CreateUserRequest)}.
 *
 * @param name  display name
 * @param email email address; normalized before storage
 */
public record CreateUserRequest(String name, String email) {}
