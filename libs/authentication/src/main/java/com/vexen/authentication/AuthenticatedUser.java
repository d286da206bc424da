package com.vexen.authentication;

import java.util.UUID;

/**
 * The identity behind a verified access token.
 */
public record AuthenticatedUser(UUID userId, String email, String name) {}
