package com.vexen.identity;

import com.vexen.database.DataAccessException;
import com.vexen.database.MigrationPlan;
import com.vexen.database.PooledDatabase;
import com.vexen.lifecycle.SubsystemException;
import com.vexen.observability.ComponentHealth;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Identity subsystem storing users in a relational database.
 */
public final class JdbcIdentitySystem implements IdentitySystem {

    private static final Logger log = LoggerFactory.getLogger(JdbcIdentitySystem.class);

    private final IdentityConfig config;
    private final Clock clock;

    private PooledDatabase database;
    private JdbcUserRepository repository;
    private UserService users;

    public JdbcIdentitySystem(IdentityConfig config) {
        this(config, Clock.systemUTC());
    }

    public JdbcIdentitySystem(IdentityConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        this.config = config;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void init() {
        if (database != null) {
            throw new IllegalStateException("identity subsystem already initialized");
        }
        try {
            database = PooledDatabase.open(config.database(), MigrationPlan.forSubsystem(NAME));
        } catch (IllegalArgumentException | DataAccessException e) {
            throw new SubsystemException(NAME, "cannot open user store: " + e.getMessage(), e);
        }
        repository = new JdbcUserRepository(database.sql());
        users = new UserService(repository, clock);
        log.info("Identity subsystem initialized with {}", config);
    }

    @Override
    public UserService users() {
        requireInitialized();
        return users;
    }

    @Override
    public IdentityLookup repository() {
        requireInitialized();
        return repository;
    }

    @Override
    public ComponentHealth health() {
        if (database == null) {
            return ComponentHealth.notInitialized(NAME);
        }
        return database.health(NAME);
    }

    @Override
    public void close() {
        if (database != null) {
            database.close();
            database = null;
            repository = null;
            users = null;
            log.info("Identity subsystem closed");
        }
    }

    private void requireInitialized() {
        if (database == null) {
            throw new IllegalStateException("identity subsystem not initialized");
        }
    }
}
