package com.vexen.authentication;

import com.vexen.database.JdbcSupport;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Credentials in the {@code vexen_credentials} table.
 */
final class CredentialStore {

    private static final String COLUMNS = "user_id, email, password_hash, created_at, last_login_at";

    private final JdbcSupport sql;

    CredentialStore(JdbcSupport sql) {
        this.sql = sql;
    }

    void insert(Credential credential) {
        sql.update("INSERT INTO vexen_credentials (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?)",
                credential.userId(), credential.email(), credential.passwordHash(),
                credential.createdAt(), credential.lastLoginAt());
    }

    Optional<Credential> findByUserId(UUID userId) {
        return sql.queryOne("SELECT " + COLUMNS + " FROM vexen_credentials WHERE user_id = ?",
                CredentialStore::map, userId);
    }

    Optional<Credential> findByEmail(String email) {
        return sql.queryOne("SELECT " + COLUMNS + " FROM vexen_credentials WHERE email = ?",
                CredentialStore::map, email);
    }

    void recordLogin(UUID userId, Instant at) {
        sql.update("UPDATE vexen_credentials SET last_login_at = ? WHERE user_id = ?", at, userId);
    }

    boolean updatePassword(UUID userId, String passwordHash) {
        return sql.update("UPDATE vexen_credentials SET password_hash = ? WHERE user_id = ?",
                passwordHash, userId) > 0;
    }

    boolean delete(UUID userId) {
        return sql.update("DELETE FROM vexen_credentials WHERE user_id = ?", userId) > 0;
    }

    private static Credential map(ResultSet rs) throws SQLException {
        return new Credential(
                rs.getObject("user_id", UUID.class),
                rs.getString("email"),
                rs.getString("password_hash"),
                JdbcSupport.instant(rs, "created_at"),
                JdbcSupport.instant(rs, "last_login_at"));
    }
}
