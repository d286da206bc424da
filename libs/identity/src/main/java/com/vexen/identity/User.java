package com.vexen.identity;

import java.time.Instant;
import java.util.UUID;

/**
 * An identity known to Vexen.
 *
 * @param id        stable identifier
 * @param email     normalized (trimmed, lower-case) email address, unique
 * @param name      display name
 * @param active    inactive identities cannot authenticate
 * @param createdAt creation time
 * @param updatedAt last modification time
 */
public record User(UUID id, String email, String name, boolean active, Instant createdAt, Instant updatedAt) {}
