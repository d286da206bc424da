package com.vexen.authentication;

import com.vexen.observability.SecretRedactor;
import java.util.UUID;

/**
 * Creates a credential for an existing identity.
 */
public record RegisterRequest(UUID userId, String email, String password) {

    @Override
    public String toString() {
        return "RegisterRequest[userId=" + userId + ", email=" + email + ", password=" + SecretRedactor.REDACTED + "]";
    }
}
