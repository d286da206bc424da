package com.vexen.authorization;

import com.vexen.database.DataAccessException;
import com.vexen.database.MigrationPlan;
import com.vexen.database.PooledDatabase;
import com.vexen.lifecycle.SubsystemException;
import com.vexen.observability.ComponentHealth;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authorization subsystem storing roles, permissions and assignments in a relational database.
 */
public final class JdbcAuthorizationSystem implements AuthorizationSystem {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuthorizationSystem.class);

    private final AuthorizationConfig config;
    private final Clock clock;

    private PooledDatabase database;
    private RoleService roles;
    private PermissionService permissions;
    private AccessService access;

    public JdbcAuthorizationSystem(AuthorizationConfig config) {
        this(config, Clock.systemUTC());
    }

    public JdbcAuthorizationSystem(AuthorizationConfig config, Clock clock) {
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
            throw new IllegalStateException("authorization subsystem already initialized");
        }
        try {
            database = PooledDatabase.open(config.database(), MigrationPlan.forSubsystem(NAME));
        } catch (IllegalArgumentException | DataAccessException e) {
            throw new SubsystemException(NAME, "cannot open role store: " + e.getMessage(), e);
        }
        RbacStore store = new RbacStore(database.sql());
        permissions = new PermissionService(store, clock);
        roles = new RoleService(store, permissions, clock);
        access = new AccessService(store, roles);
        log.info("Authorization subsystem initialized with {}", config);
    }

    @Override
    public RoleService roles() {
        requireInitialized();
        return roles;
    }

    @Override
    public PermissionService permissions() {
        requireInitialized();
        return permissions;
    }

    @Override
    public AccessService access() {
        requireInitialized();
        return access;
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
            roles = null;
            permissions = null;
            access = null;
            log.info("Authorization subsystem closed");
        }
    }

    private void requireInitialized() {
        if (database == null) {
            throw new IllegalStateException("authorization subsystem not initialized");
        }
    }
}
