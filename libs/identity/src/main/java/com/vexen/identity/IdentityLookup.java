package com.vexen.identity;

import java.util.Optional;
import java.util.UUID;

/**
 * Read-only view of the identity store, handed to other subsystems that need to resolve
 * identities without owning a copy of them.
 */
public interface IdentityLookup {

    Optional<User> findById(UUID id);

    /**
     * Looks up an identity by email. The argument is normalized the same way stored emails are.
     */
    Optional<User> findByEmail(String email);
}
