package com.vexen.authentication;

import com.vexen.lifecycle.Subsystem;

/**
 * Authentication subsystem: credentials and signed tokens.
 */
public interface AuthenticationSystem extends Subsystem {

    String NAME = "authentication";

    /**
     * @throws IllegalStateException if the subsystem is not initialized
     */
    AuthService service();
}
