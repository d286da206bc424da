package com.vexen.authentication;

/**
 * Thrown when a credential or token is refused.
 */
public class AuthenticationException extends RuntimeException {

    /** Why authentication was refused. */
    public enum Reason {
        INVALID_CREDENTIALS,
        UNKNOWN_IDENTITY,
        INACTIVE_IDENTITY,
        ALREADY_REGISTERED,
        INVALID_TOKEN,
        EXPIRED_TOKEN
    }

    private final Reason reason;

    public AuthenticationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AuthenticationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
