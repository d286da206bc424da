package com.vexen.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.vexen.authentication.AuthenticationConfig;
import com.vexen.authentication.AuthenticationSystem;
import com.vexen.authorization.AuthorizationSystem;
import com.vexen.identity.IdentityLookup;
import com.vexen.identity.IdentitySystem;
import com.vexen.lifecycle.SubsystemException;
import com.vexen.observability.ComponentHealth;
import com.vexen.observability.HealthStatus;
import com.vexen.observability.LifecycleMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("VexenContainer")
class VexenContainerTest {

    private static final VexenConfig CONFIG = new VexenConfig("jdbc:h2:mem:unused", "secret");

    @Mock
    private IdentitySystem identity;
    @Mock
    private AuthorizationSystem authorization;
    @Mock
    private AuthenticationSystem authentication;
    @Mock
    private IdentityLookup lookup;

    private final AtomicReference<AuthenticationConfig> authenticationSlice = new AtomicReference<>();
    private final AtomicInteger authenticationCreated = new AtomicInteger();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    private VexenContainer container;

    @BeforeEach
    void setUp() {
        lenient().when(identity.repository()).thenReturn(lookup);
        SubsystemFactories factories = new SubsystemFactories(
                slice -> identity,
                slice -> authorization,
                slice -> {
                    authenticationCreated.incrementAndGet();
                    authenticationSlice.set(slice);
                    return authentication;
                });
        container = new VexenContainer(CONFIG, factories, registry);
    }

    @Nested
    @DisplayName("before init()")
    class BeforeInit {

        @Test
        @DisplayName("every accessor fails with ContainerNotInitializedException")
        void accessorsFail() {
            assertThatThrownBy(container::identity)
                    .isInstanceOfSatisfying(ContainerNotInitializedException.class,
                            e -> assertThat(e.state()).isEqualTo(ContainerState.UNINITIALIZED))
                    .hasMessage("VexenContainer not initialized. Call init() first.");
            assertThatThrownBy(container::authorization).isInstanceOf(ContainerNotInitializedException.class);
            assertThatThrownBy(container::authentication).isInstanceOf(ContainerNotInitializedException.class);
            assertThat(container.state()).isEqualTo(ContainerState.UNINITIALIZED);
            assertThat(container.isReady()).isFalse();
        }

        @Test
        @DisplayName("close() is a no-op")
        void closeIsNoOp() {
            container.close();
            container.close();

            assertThat(container.state()).isEqualTo(ContainerState.UNINITIALIZED);
            assertThat(container.teardownFailure()).isEmpty();
            verifyNoInteractions(identity, authorization, authentication);
        }

        @Test
        @DisplayName("health() is UNHEALTHY with no components")
        void health() {
            var health = container.health();

            assertThat(health.status()).isEqualTo(HealthStatus.UNHEALTHY);
            assertThat(health.components()).isEmpty();
        }
    }

    @Nested
    @DisplayName("init()")
    class Init {

        @Test
        @DisplayName("brings subsystems up in order and exposes the same handles")
        void bringsUpInOrder() {
            container.init();

            InOrder order = inOrder(identity, authorization, authentication);
            order.verify(identity).init();
            order.verify(authorization).init();
            order.verify(authentication).init();
            assertThat(container.state()).isEqualTo(ContainerState.READY);
            assertThat(container.identity()).isSameAs(identity).isSameAs(container.identity());
            assertThat(container.authorization()).isSameAs(authorization).isSameAs(container.authorization());
            assertThat(container.authentication()).isSameAs(authentication).isSameAs(container.authentication());
        }

        @Test
        @DisplayName("authentication is built with the live identity lookup and token lifetimes")
        void authenticationSlice() {
            container.init();

            AuthenticationConfig slice = authenticationSlice.get();
            assertThat(slice.identityLookup()).isSameAs(lookup);
            assertThat(slice.secretKey()).isEqualTo("secret");
            assertThat(slice.accessTokenTtl()).isEqualTo(Duration.ofMinutes(15));
            assertThat(slice.refreshTokenTtl()).isEqualTo(Duration.ofDays(30));
        }

        @Test
        @DisplayName("a second init() is rejected without touching the subsystems")
        void secondInitRejected() {
            container.init();

            assertThatThrownBy(container::init)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("already initialized");
            verify(identity).init();
            assertThat(authenticationCreated).hasValue(1);
        }

        @Test
        @DisplayName("an authorization failure closes identity and propagates unchanged")
        void authorizationFailure() {
            var failure = new SubsystemException("authorization", "cannot open role store");
            doThrow(failure).when(authorization).init();

            assertThatThrownBy(container::init).isSameAs(failure);

            verify(identity).close();
            assertThat(authenticationCreated).hasValue(0);
            assertThat(container.state()).isEqualTo(ContainerState.UNINITIALIZED);
            assertThatThrownBy(container::identity).isInstanceOf(ContainerNotInitializedException.class);
        }

        @Test
        @DisplayName("an authentication failure closes authorization, then identity")
        void authenticationFailure() {
            var failure = new SubsystemException("authentication", "secret key must not be blank");
            doThrow(failure).when(authentication).init();

            assertThatThrownBy(container::init).isSameAs(failure);

            InOrder order = inOrder(authorization, identity);
            order.verify(authorization).close();
            order.verify(identity).close();
            verify(authentication, never()).close();
        }

        @Test
        @DisplayName("teardown failures during rollback are attached as suppressed")
        void rollbackFailuresSuppressed() {
            var failure = new SubsystemException("authentication", "boom");
            var closeFailure = new IllegalStateException("pool stuck");
            doThrow(failure).when(authentication).init();
            doThrow(closeFailure).when(authorization).close();

            Throwable thrown = catchThrowable(container::init);

            assertThat(thrown).isSameAs(failure);
            assertThat(thrown.getSuppressed()).containsExactly(closeFailure);
            verify(identity).close();
        }

        @Test
        @DisplayName("an Error from a later subsystem still rolls back the earlier ones")
        void rollbackOnError() {
            var linkageError = new NoClassDefFoundError("org/postgresql/Driver");
            doThrow(linkageError).when(authorization).init();

            Throwable thrown = catchThrowable(container::init);

            assertThat(thrown).isSameAs(linkageError);
            assertThat(container.state()).isEqualTo(ContainerState.UNINITIALIZED);
            verify(identity).close();
            verify(authorization, never()).close();
            assertThat(authenticationCreated).hasValue(0);
        }

        @Test
        @DisplayName("can be retried after a failure")
        void retryAfterFailure() {
            doThrow(new SubsystemException("authorization", "transient")).doNothing().when(authorization).init();

            assertThatThrownBy(container::init).isInstanceOf(SubsystemException.class);
            container.init();

            assertThat(container.isReady()).isTrue();
        }
    }

    @Nested
    @DisplayName("close()")
    class Close {

        @BeforeEach
        void init() {
            container.init();
        }

        @Test
        @DisplayName("tears down in reverse order and invalidates the accessors")
        void reverseOrder() {
            container.close();

            InOrder order = inOrder(authentication, authorization, identity);
            order.verify(authentication).close();
            order.verify(authorization).close();
            order.verify(identity).close();
            assertThat(container.state()).isEqualTo(ContainerState.CLOSED);
            assertThatThrownBy(container::identity)
                    .isInstanceOfSatisfying(ContainerNotInitializedException.class,
                            e -> assertThat(e.state()).isEqualTo(ContainerState.CLOSED))
                    .hasMessage("VexenContainer is closed.");
        }

        @Test
        @DisplayName("continues past failures and aggregates them")
        void aggregatesFailures() {
            var authenticationFailure = new IllegalStateException("authentication stuck");
            var identityFailure = new IllegalStateException("identity stuck");
            doThrow(authenticationFailure).when(authentication).close();
            doThrow(identityFailure).when(identity).close();

            container.close();

            verify(authorization).close();
            assertThat(container.state()).isEqualTo(ContainerState.CLOSED);
            assertThat(container.teardownFailure()).hasValueSatisfying(e -> {
                assertThat(e.failures()).containsOnlyKeys("authentication", "identity");
                assertThat(e.failures().get("identity")).isSameAs(identityFailure);
                assertThat(e.getSuppressed()).containsExactly(authenticationFailure, identityFailure);
            });
        }

        @Test
        @DisplayName("is idempotent and CLOSED is terminal")
        void terminal() {
            container.close();
            container.close();

            verify(identity).close();
            assertThatThrownBy(container::init)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("closed");
        }
    }

    @Nested
    @DisplayName("observability")
    class Observability {

        @Test
        @DisplayName("health() aggregates the subsystems")
        void health() {
            container.init();
            when(identity.health()).thenReturn(ComponentHealth.healthy("identity", 1));
            when(authorization.health()).thenReturn(ComponentHealth.degraded("authorization", "slow", 900));
            when(authentication.health()).thenReturn(ComponentHealth.healthy("authentication", 1));

            var health = container.health();

            assertThat(health.status()).isEqualTo(HealthStatus.DEGRADED);
            assertThat(health.components()).containsOnlyKeys("identity", "authorization", "authentication");
        }

        @Test
        @DisplayName("a throwing health probe counts as UNHEALTHY")
        void throwingProbe() {
            container.init();
            when(identity.health()).thenThrow(new IllegalStateException("probe failed"));
            when(authorization.health()).thenReturn(ComponentHealth.healthy("authorization", 1));
            when(authentication.health()).thenReturn(ComponentHealth.healthy("authentication", 1));

            var health = container.health();

            assertThat(health.status()).isEqualTo(HealthStatus.UNHEALTHY);
            assertThat(health.components().get("identity").message()).isEqualTo("probe failed");
        }

        @Test
        @DisplayName("records lifecycle timings and the ready gauge")
        void metrics() {
            container.init();

            assertThat(registry.get(LifecycleMetrics.READY_METRIC)
                    .tag(LifecycleMetrics.TAG_CONTAINER, container.name()).gauge().value()).isEqualTo(1.0);
            assertThat(registry.get(LifecycleMetrics.DURATION_METRIC)
                    .tag(LifecycleMetrics.TAG_SUBSYSTEM, "identity")
                    .tag(LifecycleMetrics.TAG_PHASE, "init")
                    .tag(LifecycleMetrics.TAG_OUTCOME, "success")
                    .timer().count()).isEqualTo(1);

            container.close();

            assertThat(registry.find(LifecycleMetrics.READY_METRIC)
                    .tag(LifecycleMetrics.TAG_CONTAINER, container.name()).gauge()).isNull();
            assertThat(registry.get(LifecycleMetrics.DURATION_METRIC)
                    .tag(LifecycleMetrics.TAG_SUBSYSTEM, "authentication")
                    .tag(LifecycleMetrics.TAG_PHASE, "close")
                    .timer().count()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("rejects a null configuration")
    void nullConfig() {
        assertThatThrownBy(() -> new VexenContainer(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
