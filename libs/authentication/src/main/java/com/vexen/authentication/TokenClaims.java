package com.vexen.authentication;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Payload of a signed token. Times are epoch seconds.
 *
 * @param subject   user id
 * @param email     email the credential was registered with
 * @param type      access or refresh
 * @param issuedAt  issue time
 * @param expiresAt expiry time, exclusive
 * @param tokenId   unique token id
 */
public record TokenClaims(
        @JsonProperty("sub") String subject,
        @JsonProperty("email") String email,
        @JsonProperty("typ") TokenType type,
        @JsonProperty("iat") long issuedAt,
        @JsonProperty("exp") long expiresAt,
        @JsonProperty("jti") String tokenId) {

    /**
     * Claims for a new token issued at {@code now}.
     */
    public static TokenClaims of(UUID userId, String email, TokenType type, Instant now, Duration ttl) {
        long iat = now.getEpochSecond();
        return new TokenClaims(userId.toString(), email, type, iat, iat + ttl.toSeconds(), UUID.randomUUID().toString());
    }

    /**
     * @throws IllegalArgumentException if the subject is not a UUID
     */
    @JsonIgnore
    public UUID userId() {
        return UUID.fromString(subject);
    }

    @JsonIgnore
    public Instant expiry() {
        return Instant.ofEpochSecond(expiresAt);
    }
}
