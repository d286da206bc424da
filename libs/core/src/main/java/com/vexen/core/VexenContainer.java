package com.vexen.core;

import com.vexen.authentication.AuthenticationSystem;
import com.vexen.authorization.AuthorizationSystem;
import com.vexen.identity.IdentitySystem;
import com.vexen.lifecycle.Subsystem;
import com.vexen.observability.ComponentHealth;
import com.vexen.observability.HealthResult;
import com.vexen.observability.LifecycleMetrics;
import com.vexen.observability.LifecycleMetrics.Phase;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composition root owning the identity, authorization and authentication subsystems.
 * <p>
 * {@link #init()} brings the subsystems up in that order; authentication is handed the identity
 * subsystem's {@link com.vexen.identity.IdentityLookup}. {@link #close()} tears them down in reverse.
 * <pre>{@code
 * try (VexenContainer vexen = ContainerScope.open(new VexenConfig(url, secret))) {
 *     vexen.identity().users().create(new CreateUserRequest("Ada", "ada@example.com"));
 * }
 * }</pre>
 * Lifecycle calls must not overlap; once {@code init()} has returned, the accessors may be called
 * from any thread.
 */
public final class VexenContainer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(VexenContainer.class);

    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private record Running(String name, Subsystem subsystem) {}

    private final VexenConfig config;
    private final SubsystemFactories factories;
    private final LifecycleMetrics metrics;

    private volatile ContainerState state = ContainerState.UNINITIALIZED;
    private volatile SubsystemTeardownException teardownFailure;

    private IdentitySystem identity;
    private AuthorizationSystem authorization;
    private AuthenticationSystem authentication;

    public VexenContainer(VexenConfig config) {
        this(config, SubsystemFactories.defaults());
    }

    public VexenContainer(VexenConfig config, SubsystemFactories factories) {
        this(config, factories, new SimpleMeterRegistry());
    }

    public VexenContainer(VexenConfig config, SubsystemFactories factories, MeterRegistry registry) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        if (factories == null) {
            throw new IllegalArgumentException("factories must not be null");
        }
        this.config = config;
        this.factories = factories;
        this.metrics = new LifecycleMetrics(registry, "vexen-" + SEQUENCE.incrementAndGet());
    }

    /**
     * Initializes identity, authorization and authentication, in that order.
     * <p>
     * If a subsystem fails, the ones already initialized are closed in reverse order, their
     * teardown failures are added as suppressed exceptions, and the original failure is rethrown.
     * The container then stays {@link ContainerState#UNINITIALIZED}.
     *
     * @throws IllegalStateException if the container is already initialized or closed
     */
    public void init() {
        switch (state) {
            case READY -> throw new IllegalStateException("VexenContainer already initialized");
            case CLOSED -> throw new IllegalStateException("VexenContainer is closed and cannot be re-initialized");
            default -> { }
        }
        log.info("Initializing VexenContainer {} with {}", metrics.containerName(), config);

        List<Running> started = new ArrayList<>(3);
        try {
            IdentitySystem identitySystem = bringUp(IdentitySystem.NAME,
                    () -> factories.identity().create(ConfigSlices.identity(config)));
            started.add(new Running(IdentitySystem.NAME, identitySystem));

            AuthorizationSystem authorizationSystem = bringUp(AuthorizationSystem.NAME,
                    () -> factories.authorization().create(ConfigSlices.authorization(config)));
            started.add(new Running(AuthorizationSystem.NAME, authorizationSystem));

            AuthenticationSystem authenticationSystem = bringUp(AuthenticationSystem.NAME,
                    () -> factories.authentication().create(
                            ConfigSlices.authentication(config, identitySystem.repository())));

            identity = identitySystem;
            authorization = authorizationSystem;
            authentication = authenticationSystem;
        } catch (Throwable e) {
            if (!started.isEmpty()) {
                log.warn("Rolling back {} initialized subsystem(s)", started.size());
                tearDown(started).values().forEach(e::addSuppressed);
            }
            throw e;
        }
        state = ContainerState.READY;
        metrics.ready(true);
        log.info("VexenContainer {} ready", metrics.containerName());
    }

    /**
     * @throws ContainerNotInitializedException unless the container is {@link ContainerState#READY}
     */
    public IdentitySystem identity() {
        requireReady();
        return identity;
    }

    /**
     * @throws ContainerNotInitializedException unless the container is {@link ContainerState#READY}
     */
    public AuthorizationSystem authorization() {
        requireReady();
        return authorization;
    }

    /**
     * @throws ContainerNotInitializedException unless the container is {@link ContainerState#READY}
     */
    public AuthenticationSystem authentication() {
        requireReady();
        return authentication;
    }

    /**
     * Closes authentication, authorization and identity, in that order. Every subsystem is closed
     * even if an earlier one fails; failures are logged and kept in {@link #teardownFailure()}.
     * A no-op unless the container is {@link ContainerState#READY}.
     */
    @Override
    public void close() {
        if (state != ContainerState.READY) {
            log.debug("close() on {} VexenContainer {} ignored", state, metrics.containerName());
            return;
        }
        List<Running> running = List.of(
                new Running(IdentitySystem.NAME, identity),
                new Running(AuthorizationSystem.NAME, authorization),
                new Running(AuthenticationSystem.NAME, authentication));
        state = ContainerState.CLOSED;
        metrics.ready(false);

        Map<String, RuntimeException> failures = tearDown(running);
        identity = null;
        authorization = null;
        authentication = null;
        metrics.release();

        if (failures.isEmpty()) {
            log.info("VexenContainer {} closed", metrics.containerName());
        } else {
            teardownFailure = new SubsystemTeardownException(failures);
            log.warn("VexenContainer {} closed with failures: {}", metrics.containerName(), failures.keySet());
        }
    }

    /** Aggregated failures of the last {@link #close()}, if any subsystem failed to close. */
    public Optional<SubsystemTeardownException> teardownFailure() {
        return Optional.ofNullable(teardownFailure);
    }

    /**
     * Health of every subsystem. A container that is not ready is UNHEALTHY with no components.
     */
    public HealthResult health() {
        if (state != ContainerState.READY) {
            return HealthResult.aggregate(List.of(), Instant.now());
        }
        return HealthResult.aggregate(List.of(
                probe(IdentitySystem.NAME, identity),
                probe(AuthorizationSystem.NAME, authorization),
                probe(AuthenticationSystem.NAME, authentication)), Instant.now());
    }

    public ContainerState state() {
        return state;
    }

    public boolean isReady() {
        return state == ContainerState.READY;
    }

    public VexenConfig config() {
        return config;
    }

    /** Name used to tag this container's metrics. */
    public String name() {
        return metrics.containerName();
    }

    private <S extends Subsystem> S bringUp(String name, Supplier<S> factory) {
        long start = System.nanoTime();
        try {
            S subsystem = factory.get();
            subsystem.init();
            long elapsed = System.nanoTime() - start;
            metrics.record(name, Phase.INIT, elapsed, true);
            log.info("Subsystem {} initialized in {} ms", name, TimeUnit.NANOSECONDS.toMillis(elapsed));
            return subsystem;
        } catch (Throwable e) {
            metrics.record(name, Phase.INIT, System.nanoTime() - start, false);
            log.error("Subsystem {} failed to initialize", name, e);
            throw e;
        }
    }

    private Map<String, RuntimeException> tearDown(List<Running> running) {
        Map<String, RuntimeException> failures = new LinkedHashMap<>();
        for (int i = running.size() - 1; i >= 0; i--) {
            Running entry = running.get(i);
            long start = System.nanoTime();
            try {
                entry.subsystem().close();
                metrics.record(entry.name(), Phase.CLOSE, System.nanoTime() - start, true);
                log.info("Subsystem {} closed", entry.name());
            } catch (RuntimeException e) {
                metrics.record(entry.name(), Phase.CLOSE, System.nanoTime() - start, false);
                log.warn("Subsystem {} failed to close", entry.name(), e);
                failures.put(entry.name(), e);
            }
        }
        return failures;
    }

    private static ComponentHealth probe(String name, Subsystem subsystem) {
        try {
            return subsystem.health();
        } catch (RuntimeException e) {
            return ComponentHealth.unhealthy(name, e.getMessage(), 0);
        }
    }

    private void requireReady() {
        ContainerState current = state;
        if (current != ContainerState.READY) {
            throw new ContainerNotInitializedException(current);
        }
    }
}
