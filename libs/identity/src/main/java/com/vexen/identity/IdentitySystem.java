package com.vexen.identity;

import com.vexen.lifecycle.Subsystem;

/**
 * Public surface of the identity subsystem.
 */
public interface IdentitySystem extends Subsystem {

    /** Subsystem name used in logs, health and metrics. */
    String NAME = "identity";

    /**
     * User management operations.
     *
     * @throws IllegalStateException if the subsystem is not initialized
     */
    UserService users();

    /**
     * The data-access surface other subsystems resolve identities through. The returned reference
     * is live: it reads the same store {@link #users()} writes to.
     *
     * @throws IllegalStateException if the subsystem is not initialized
     */
    IdentityLookup repository();
}
