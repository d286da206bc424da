package com.vexen.database;

/**
 * Connection and pool settings for one subsystem's database access.
 *
 * @param url         JDBC connection URL (e.g., {@code jdbc:postgresql://localhost:5432/vexen})
 * @param echo        log every SQL statement on the {@code vexen.sql} logger
 * @param poolSize    connections kept open while idle
 * @param maxOverflow additional connections the pool may open under load
 */
public record DatabaseSettings(String url, boolean echo, int poolSize, int maxOverflow) {

    public static final int DEFAULT_POOL_SIZE = 5;
    public static final int DEFAULT_MAX_OVERFLOW = 10;

    /**
     * Settings with default pool sizing and echo disabled.
     */
    public static DatabaseSettings of(String url) {
        return new DatabaseSettings(url, false, DEFAULT_POOL_SIZE, DEFAULT_MAX_OVERFLOW);
    }

    /**
     * Upper bound on open connections: the idle pool plus the overflow.
     */
    public int maximumPoolSize() {
        return poolSize + maxOverflow;
    }
}
