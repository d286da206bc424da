package com.vexen.authorization;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Role management and permission grants.
 */
public class RoleService {

    private final RbacStore store;
    private final PermissionService permissions;
    private final Clock clock;

    RoleService(RbacStore store, PermissionService permissions, Clock clock) {
        this.store = store;
        this.permissions = permissions;
        this.clock = clock;
    }

    /**
     * @throws AuthorizationException with {@code DUPLICATE_NAME} if the name is taken
     */
    public Role create(CreateRoleRequest request) {
        String name = Names.require("role", request.name());
        if (store.findRole(name).isPresent()) {
            throw AuthorizationException.duplicate("Role", name);
        }
        Role role = new Role(UUID.randomUUID(), name, request.description());
        store.insertRole(role, clock.instant());
        return role;
    }

    /**
     * @throws AuthorizationException with {@code ROLE_NOT_FOUND} if there is no such role
     */
    public Role get(String name) {
        return store.findRole(Names.require("role", name))
                .orElseThrow(() -> AuthorizationException.roleNotFound(name));
    }

    /** All roles ordered by name. */
    public List<Role> list() {
        return store.listRoles();
    }

    /**
     * Deletes a role, its grants and its assignments.
     *
     * @throws AuthorizationException with {@code ROLE_NOT_FOUND} if there is no such role
     */
    public void delete(String name) {
        store.deleteRole(get(name).id());
    }

    /**
     * Grants a permission to a role. Granting twice is a no-op.
     *
     * @return true if the grant was added, false if it already existed
     */
    public boolean grant(String roleName, String permissionName) {
        Role role = get(roleName);
        Permission permission = permissions.get(permissionName);
        return store.grant(role.id(), permission.id());
    }

    /**
     * @return true if a grant was removed
     */
    public boolean revoke(String roleName, String permissionName) {
        Role role = get(roleName);
        Permission permission = permissions.get(permissionName);
        return store.revoke(role.id(), permission.id());
    }

    /** Permissions granted to a role, ordered by name. */
    public List<Permission> permissionsOf(String roleName) {
        return store.permissionsOfRole(get(roleName).id());
    }
}
