package com.vexen.authorization;

import com.vexen.database.JdbcSupport;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to roles, permissions, grants and assignments.
 */
final class RbacStore {

    private final JdbcSupport sql;

    RbacStore(JdbcSupport sql) {
        this.sql = sql;
    }

    // ── Roles ──

    void insertRole(Role role, Instant createdAt) {
        sql.update("INSERT INTO vexen_roles (id, name, description, created_at) VALUES (?, ?, ?, ?)",
                role.id(), role.name(), role.description(), createdAt);
    }

    Optional<Role> findRole(String name) {
        return sql.queryOne("SELECT id, name, description FROM vexen_roles WHERE name = ?", RbacStore::role, name);
    }

    List<Role> listRoles() {
        return sql.query("SELECT id, name, description FROM vexen_roles ORDER BY name", RbacStore::role);
    }

    void deleteRole(UUID roleId) {
        sql.inTransaction(tx -> {
            tx.update("DELETE FROM vexen_role_permissions WHERE role_id = ?", roleId);
            tx.update("DELETE FROM vexen_user_roles WHERE role_id = ?", roleId);
            return tx.update("DELETE FROM vexen_roles WHERE id = ?", roleId);
        });
    }

    // ── Permissions ──

    void insertPermission(Permission permission, Instant createdAt) {
        sql.update("INSERT INTO vexen_permissions (id, name, description, created_at) VALUES (?, ?, ?, ?)",
                permission.id(), permission.name(), permission.description(), createdAt);
    }

    Optional<Permission> findPermission(String name) {
        return sql.queryOne("SELECT id, name, description FROM vexen_permissions WHERE name = ?",
                RbacStore::permission, name);
    }

    List<Permission> listPermissions() {
        return sql.query("SELECT id, name, description FROM vexen_permissions ORDER BY name", RbacStore::permission);
    }

    void deletePermission(UUID permissionId) {
        sql.inTransaction(tx -> {
            tx.update("DELETE FROM vexen_role_permissions WHERE permission_id = ?", permissionId);
            return tx.update("DELETE FROM vexen_permissions WHERE id = ?", permissionId);
        });
    }

    // ── Grants ──

    boolean grant(UUID roleId, UUID permissionId) {
        return sql.inTransaction(tx -> {
            boolean exists = tx.queryOne(
                    "SELECT 1 FROM vexen_role_permissions WHERE role_id = ? AND permission_id = ?",
                    rs -> Boolean.TRUE, roleId, permissionId).isPresent();
            if (exists) {
                return false;
            }
            tx.update("INSERT INTO vexen_role_permissions (role_id, permission_id) VALUES (?, ?)", roleId, permissionId);
            return true;
        });
    }

    boolean revoke(UUID roleId, UUID permissionId) {
        return sql.update("DELETE FROM vexen_role_permissions WHERE role_id = ? AND permission_id = ?",
                roleId, permissionId) > 0;
    }

    List<Permission> permissionsOfRole(UUID roleId) {
        return sql.query("""
                SELECT p.id, p.name, p.description
                  FROM vexen_permissions p
                  JOIN vexen_role_permissions rp ON rp.permission_id = p.id
                 WHERE rp.role_id = ?
                 ORDER BY p.name""", RbacStore::permission, roleId);
    }

    // ── Assignments ──

    boolean assign(UUID userId, UUID roleId) {
        return sql.inTransaction(tx -> {
            boolean exists = tx.queryOne("SELECT 1 FROM vexen_user_roles WHERE user_id = ? AND role_id = ?",
                    rs -> Boolean.TRUE, userId, roleId).isPresent();
            if (exists) {
                return false;
            }
            tx.update("INSERT INTO vexen_user_roles (user_id, role_id) VALUES (?, ?)", userId, roleId);
            return true;
        });
    }

    boolean unassign(UUID userId, UUID roleId) {
        return sql.update("DELETE FROM vexen_user_roles WHERE user_id = ? AND role_id = ?", userId, roleId) > 0;
    }

    List<Role> rolesOfUser(UUID userId) {
        return sql.query("""
                SELECT r.id, r.name, r.description
                  FROM vexen_roles r
                  JOIN vexen_user_roles ur ON ur.role_id = r.id
                 WHERE ur.user_id = ?
                 ORDER BY r.name""", RbacStore::role, userId);
    }

    boolean userHasPermission(UUID userId, String permissionName) {
        return sql.query("""
                SELECT 1
                  FROM vexen_user_roles ur
                  JOIN vexen_role_permissions rp ON rp.role_id = ur.role_id
                  JOIN vexen_permissions p ON p.id = rp.permission_id
                 WHERE ur.user_id = ? AND p.name = ?""", rs -> Boolean.TRUE, userId, permissionName)
                .stream().findAny().isPresent();
    }

    private static Role role(ResultSet rs) throws SQLException {
        return new Role(rs.getObject("id", UUID.class), rs.getString("name"), rs.getString("description"));
    }

    private static Permission permission(ResultSet rs) throws SQLException {
        return new Permission(rs.getObject("id", UUID.class), rs.getString("name"), rs.getString("description"));
    }
}
