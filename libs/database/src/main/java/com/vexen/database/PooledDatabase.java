package com.vexen.database;

import com.vexen.observability.ComponentHealth;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A subsystem's connection pool with its schema migrated.
 * <p>
 * {@link #open(DatabaseSettings, MigrationPlan)} creates a HikariCP pool sized from the settings
 * ({@code minimumIdle = poolSize}, {@code maximumPoolSize = poolSize + maxOverflow}) and runs the
 * subsystem's Flyway migrations against it. Several subsystems can point at the same database:
 * each one has its own history table and baselines at version 0, so an existing foreign schema
 * never causes its own migrations to be skipped.
 */
public final class PooledDatabase implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PooledDatabase.class);

    /** Seconds allowed for a health probe to validate a connection. */
    static final int HEALTH_PROBE_TIMEOUT_SECONDS = 2;

    private final String name;
    private final HikariDataSource dataSource;
    private final JdbcSupport sql;

    private PooledDatabase(String name, HikariDataSource dataSource, boolean echo) {
        this.name = name;
        this.dataSource = dataSource;
        this.sql = new JdbcSupport(dataSource, echo);
    }

    /**
     * Opens the pool and migrates the schema. If migration fails the pool is closed before the
     * failure propagates.
     *
     * @param settings connection and pool settings
     * @param plan     migrations to apply
     * @return an open, migrated database
     * @throws IllegalArgumentException if the URL is blank or pool sizing is invalid
     * @throws DataAccessException      if the pool cannot connect or migration fails
     */
    public static PooledDatabase open(DatabaseSettings settings, MigrationPlan plan) {
        validate(settings);
        HikariDataSource dataSource;
        try {
            dataSource = new HikariDataSource(hikariConfig(settings, plan.name()));
        } catch (RuntimeException e) {
            throw new DataAccessException("Cannot open connection pool for " + plan.name(), e);
        }
        try {
            migrate(dataSource, plan);
        } catch (RuntimeException e) {
            dataSource.close();
            throw new DataAccessException("Schema migration failed for " + plan.name(), e);
        }
        log.info("Database '{}' ready (pool size {}, max {})",
                plan.name(), settings.poolSize(), settings.maximumPoolSize());
        return new PooledDatabase(plan.name(), dataSource, settings.echo());
    }

    /** JDBC helper bound to this pool. */
    public JdbcSupport sql() {
        return sql;
    }

    /** The underlying pooled data source. */
    public DataSource dataSource() {
        return dataSource;
    }

    /**
     * Probes the pool by validating one connection.
     *
     * @param component name reported in the result
     */
    public ComponentHealth health(String component) {
        long start = System.currentTimeMillis();
        if (dataSource.isClosed()) {
            return ComponentHealth.unhealthy(component, "connection pool closed", 0);
        }
        try (Connection connection = dataSource.getConnection()) {
            long elapsed = System.currentTimeMillis() - start;
            if (connection.isValid(HEALTH_PROBE_TIMEOUT_SECONDS)) {
                return ComponentHealth.healthy(component, elapsed);
            }
            return ComponentHealth.unhealthy(component, "connection validation failed", elapsed);
        } catch (Exception e) {
            return ComponentHealth.unhealthy(component, e.getMessage(), System.currentTimeMillis() - start);
        }
    }

    /** Closes the pool. Idempotent. */
    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            log.info("Database '{}' closed", name);
        }
    }

    private static void validate(DatabaseSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        if (settings.url() == null || settings.url().isBlank()) {
            throw new IllegalArgumentException("database url must not be null or blank");
        }
        if (settings.poolSize() < 1) {
            throw new IllegalArgumentException("poolSize must be at least 1");
        }
        if (settings.maxOverflow() < 0) {
            throw new IllegalArgumentException("maxOverflow must not be negative");
        }
    }

    private static HikariConfig hikariConfig(DatabaseSettings settings, String name) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(settings.url());
        config.setMinimumIdle(settings.poolSize());
        config.setMaximumPoolSize(settings.maximumPoolSize());
        config.setPoolName("vexen-" + name);
        config.setAutoCommit(true);
        return config;
    }

    private static void migrate(DataSource dataSource, MigrationPlan plan) {
        MigrateResult result = Flyway.configure()
                .dataSource(dataSource)
                .locations(plan.location())
                .table(plan.historyTable())
                .baselineOnMigrate(true)
                .baselineVersion("0")
                .cleanDisabled(true)
                .load()
                .migrate();
        log.info("Database '{}' migrated: {} migration(s) applied, schema version {}",
                plan.name(), result.migrationsExecuted, result.targetSchemaVersion);
    }
}
