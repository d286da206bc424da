package com.vexen.authentication;

import java.time.Instant;
import java.util.UUID;

/**
 * Stored login credential of one identity.
 *
 * @param userId       identity the credential belongs to
 * @param email        normalized login email
 * @param passwordHash encoded {@link PasswordHasher} hash
 * @param createdAt    registration time
 * @param lastLoginAt  last successful login, null if never
 */
public record Credential(UUID userId, String email, String passwordHash, Instant createdAt, Instant lastLoginAt) {

    @Override
    public String toString() {
        return "Credential[userId=" + userId + ", email=" + email + ", createdAt=" + createdAt
                + ", lastLoginAt=" + lastLoginAt + "]";
    }
}
