package com.vexen.identity;

import com.vexen.database.JdbcSupport;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link UserRepository} backed by the {@code vexen_users} table.
 */
public final class JdbcUserRepository implements UserRepository {

    private static final String COLUMNS = "id, email, name, active, created_at, updated_at";

    private final JdbcSupport sql;

    public JdbcUserRepository(JdbcSupport sql) {
        this.sql = sql;
    }

    @Override
    public Optional<User> findById(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        return sql.queryOne("SELECT " + COLUMNS + " FROM vexen_users WHERE id = ?", JdbcUserRepository::map, id);
    }

    @Override
    public Optional<User> findByEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        return sql.queryOne("SELECT " + COLUMNS + " FROM vexen_users WHERE email = ?",
                JdbcUserRepository::map, Emails.normalize(email));
    }

    @Override
    public void insert(User user) {
        sql.update("INSERT INTO vexen_users (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?)",
                user.id(), user.email(), user.name(), user.active(), user.createdAt(), user.updatedAt());
    }

    @Override
    public boolean update(User user) {
        return sql.update("UPDATE vexen_users SET email = ?, name = ?, active = ?, updated_at = ? WHERE id = ?",
                user.email(), user.name(), user.active(), user.updatedAt(), user.id()) > 0;
    }

    @Override
    public boolean deleteById(UUID id) {
        return sql.update("DELETE FROM vexen_users WHERE id = ?", id) > 0;
    }

    @Override
    public List<User> findAll(int limit, int offset) {
        return sql.query("SELECT " + COLUMNS + " FROM vexen_users ORDER BY created_at, id LIMIT ? OFFSET ?",
                JdbcUserRepository::map, limit, offset);
    }

    private static User map(ResultSet rs) throws SQLException {
        return new User(
                rs.getObject("id", UUID.class),
                rs.getString("email"),
                rs.getString("name"),
                rs.getBoolean("active"),
                JdbcSupport.instant(rs, "created_at"),
                JdbcSupport.instant(rs, "updated_at"));
    }
}
