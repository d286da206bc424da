package com.vexen.authorization;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Permission management.
 */
public class PermissionService {

    private final RbacStore store;
    private final Clock clock;

    PermissionService(RbacStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * @throws AuthorizationException with {@code DUPLICATE_NAME} if the name is taken
     */
    public Permission create(CreatePermissionRequest request) {
        String name = Names.require("permission", request.name());
        if (store.findPermission(name).isPresent()) {
            throw AuthorizationException.duplicate("Permission", name);
        }
        Permission permission = new Permission(UUID.randomUUID(), name, request.description());
        store.insertPermission(permission, clock.instant());
        return permission;
    }

    /**
     * @throws AuthorizationException with {@code PERMISSION_NOT_FOUND} if there is no such permission
     */
    public Permission get(String name) {
        return store.findPermission(Names.require("permission", name))
                .orElseThrow(() -> AuthorizationException.permissionNotFound(name));
    }

    /** All permissions ordered by name. */
    public List<Permission> list() {
        return store.listPermissions();
    }

    /**
     * Deletes a permission and every grant of it.
     *
     * @throws AuthorizationException with {@code PERMISSION_NOT_FOUND} if there is no such permission
     */
    public void delete(String name) {
        store.deletePermission(get(name).id());
    }
}
