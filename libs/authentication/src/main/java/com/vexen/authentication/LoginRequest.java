package com.vexen.authentication;

import com.vexen.observability.SecretRedactor;

public record LoginRequest(String email, String password) {

    @Override
    public String toString() {
        return "LoginRequest[email=" + email + ", password=" + SecretRedactor.REDACTED + "]";
    }
}
