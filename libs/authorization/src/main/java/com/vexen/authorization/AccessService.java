package com.vexen.authorization;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Role assignments and access checks for users.
 * <p>
 * Users are referenced by id only; this subsystem does not verify that an id is a known identity.
 */
public class AccessService {

    private final RbacStore store;
    private final RoleService roles;

    AccessService(RbacStore store, RoleService roles) {
        this.store = store;
        this.roles = roles;
    }

    /**
     * Assigns a role to a user. Assigning twice is a no-op.
     *
     * @return true if the assignment was added
     * @throws AuthorizationException with {@code ROLE_NOT_FOUND} if there is no such role
     */
    public boolean assign(UUID userId, String roleName) {
        requireUser(userId);
        return store.assign(userId, roles.get(roleName).id());
    }

    /**
     * @return true if an assignment was removed
     */
    public boolean unassign(UUID userId, String roleName) {
        requireUser(userId);
        return store.unassign(userId, roles.get(roleName).id());
    }

    /** Roles assigned to a user, ordered by name. */
    public List<Role> rolesOf(UUID userId) {
        requireUser(userId);
        return store.rolesOfUser(userId);
    }

    /**
     * Checks if the user has the given role.
     */
    public boolean hasRole(UUID userId, String roleName) {
        return roleNames(userId).contains(roleName);
    }

    /**
     * Checks if the user has ANY of the given roles.
     */
    public boolean hasAnyRole(UUID userId, String... roleNames) {
        Set<String> assigned = roleNames(userId);
        for (String role : roleNames) {
            if (assigned.contains(role)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks if the user has ALL of the given roles.
     */
    public boolean hasAllRoles(UUID userId, String... roleNames) {
        Set<String> assigned = roleNames(userId);
        for (String role : roleNames) {
            if (!assigned.contains(role)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks if any role assigned to the user grants the permission.
     */
    public boolean hasPermission(UUID userId, String permissionName) {
        requireUser(userId);
        return store.userHasPermission(userId, permissionName);
    }

    private Set<String> roleNames(UUID userId) {
        return rolesOf(userId).stream().map(Role::name).collect(Collectors.toSet());
    }

    private static void requireUser(UUID userId) {
        if (userId == null) {
            throw new IllegalArgumentException("userId must not be null");
        }
    }
}
