package com.vexen.identity;

import com.vexen.database.DatabaseSettings;
import com.vexen.observability.SecretRedactor;

/**
 * Configuration slice for the identity subsystem.
 *
 * @param databaseUrl JDBC connection URL
 * @param echo        log every SQL statement
 * @param poolSize    connections kept open while idle
 * @param maxOverflow additional connections under load
 */
public record IdentityConfig(String databaseUrl, boolean echo, int poolSize, int maxOverflow) {

    /** Database settings for the identity connection pool. */
    public DatabaseSettings database() {
        return new DatabaseSettings(databaseUrl, echo, poolSize, maxOverflow);
    }

    @Override
    public String toString() {
        return "IdentityConfig[databaseUrl=%s, echo=%s, poolSize=%d, maxOverflow=%d]"
                .formatted(SecretRedactor.maskConnectionString(databaseUrl), echo, poolSize, maxOverflow);
    }
}
