package com.vexen.authorization;

/**
 * Thrown when a role or permission operation refers to something that does not exist, or would
 * create a duplicate name.
 */
public class AuthorizationException extends RuntimeException {

    /** Why the operation was refused. */
    public enum Reason {
        ROLE_NOT_FOUND,
        PERMISSION_NOT_FOUND,
        DUPLICATE_NAME
    }

    private final Reason reason;

    public AuthorizationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    static AuthorizationException roleNotFound(String name) {
        return new AuthorizationException(Reason.ROLE_NOT_FOUND, "Role not found: " + name);
    }

    static AuthorizationException permissionNotFound(String name) {
        return new AuthorizationException(Reason.PERMISSION_NOT_FOUND, "Permission not found: " + name);
    }

    static AuthorizationException duplicate(String kind, String name) {
        return new AuthorizationException(Reason.DUPLICATE_NAME, kind + " already exists: " + name);
    }
}
