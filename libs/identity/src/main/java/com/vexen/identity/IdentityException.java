package com.vexen.identity;

/**
 * Thrown by {@link UserService} when an operation conflicts with the stored identities.
 */
public class IdentityException extends RuntimeException {

    /** Why the operation was refused. */
    public enum Reason {
        USER_NOT_FOUND,
        DUPLICATE_EMAIL
    }

    private final Reason reason;

    public IdentityException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    static IdentityException notFound(Object key) {
        return new IdentityException(Reason.USER_NOT_FOUND, "User not found: " + key);
    }

    static IdentityException duplicateEmail(String email) {
        return new IdentityException(Reason.DUPLICATE_EMAIL, "Email already registered: " + email);
    }
}
