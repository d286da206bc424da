package com.vexen.authentication;

import com.vexen.database.DataAccessException;
import com.vexen.database.MigrationPlan;
import com.vexen.database.PooledDatabase;
import com.vexen.lifecycle.SubsystemException;
import com.vexen.observability.ComponentHealth;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authentication subsystem with credentials in a relational database.
 */
public final class JdbcAuthenticationSystem implements AuthenticationSystem {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuthenticationSystem.class);

    private final AuthenticationConfig config;
    private final PasswordHasher hasher;
    private final Clock clock;

    private PooledDatabase database;
    private AuthService service;

    public JdbcAuthenticationSystem(AuthenticationConfig config) {
        this(config, new PasswordHasher(), Clock.systemUTC());
    }

    public JdbcAuthenticationSystem(AuthenticationConfig config, PasswordHasher hasher, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        this.config = config;
        this.hasher = hasher;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void init() {
        if (database != null) {
            throw new IllegalStateException("authentication subsystem already initialized");
        }
        if (config.secretKey() == null || config.secretKey().isBlank()) {
            throw new SubsystemException(NAME, "secret key must not be blank");
        }
        TokenIssuer tokens = new TokenIssuer(config.secretKey(), config.algorithm(), clock);
        try {
            database = PooledDatabase.open(config.database(), MigrationPlan.forSubsystem(NAME));
        } catch (IllegalArgumentException | DataAccessException e) {
            throw new SubsystemException(NAME, "cannot open credential store: " + e.getMessage(), e);
        }
        service = new AuthService(new CredentialStore(database.sql()), config.identityLookup(), hasher, tokens,
                config.accessTokenTtl(), config.refreshTokenTtl(), clock);
        log.info("Authentication subsystem initialized with {}", config);
    }

    @Override
    public AuthService service() {
        if (service == null) {
            throw new IllegalStateException("authentication subsystem not initialized");
        }
        return service;
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
            service = null;
            log.info("Authentication subsystem closed");
        }
    }
}
