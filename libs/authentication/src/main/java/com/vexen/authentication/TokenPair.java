package com.vexen.authentication;

import java.time.Instant;
import java.util.UUID;

/**
 * Tokens handed out by a successful login or refresh.
 */
public record TokenPair(
        String accessToken,
        String refreshToken,
        UUID userId,
        Instant accessExpiresAt,
        Instant refreshExpiresAt) {}
