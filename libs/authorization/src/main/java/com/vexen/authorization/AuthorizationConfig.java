package com.vexen.authorization;

import com.vexen.database.DatabaseSettings;
import com.vexen.observability.SecretRedactor;

/**
 * Configuration slice for the authorization subsystem.
 *
 * @param databaseUrl JDBC connection URL
 * @param echo        log every SQL statement
 * @param poolSize    connections kept open while idle
 * @param maxOverflow additional connections under load
 */
public record AuthorizationConfig(String databaseUrl, boolean echo, int poolSize, int maxOverflow) {

    /** Database settings for the authorization connection pool. */
    public DatabaseSettings database() {
        return new DatabaseSettings(databaseUrl, echo, poolSize, maxOverflow);
    }

    @Override
    public String toString() {
        return "AuthorizationConfig[databaseUrl=%s, echo=%s, poolSize=%d, maxOverflow=%d]"
                .formatted(SecretRedactor.maskConnectionString(databaseUrl), echo, poolSize, maxOverflow);
    }
}
