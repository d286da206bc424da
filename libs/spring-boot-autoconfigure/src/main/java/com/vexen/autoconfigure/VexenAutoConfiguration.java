package com.vexen.autoconfigure;

import com.vexen.authentication.AuthService;
import com.vexen.authorization.AccessService;
import com.vexen.authorization.PermissionService;
import com.vexen.authorization.RoleService;
import com.vexen.core.ContainerScope;
import com.vexen.core.SubsystemFactories;
import com.vexen.core.VexenConfig;
import com.vexen.core.VexenContainer;
import com.vexen.identity.UserService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Runs a {@link VexenContainer} for the lifetime of the application context.
 *
 * <p>Active once {@code vexen.database-url} is set. The container is initialized while the bean
 * is created, so a subsystem that cannot start fails the context, and it is closed when the
 * context shuts down. The subsystem services are exposed as beans for injection.
 *
 * <p>A {@link MeterRegistry} bean, if present, receives the lifecycle metrics.
 *
 * @see VexenProperties
 */
@AutoConfiguration
@EnableConfigurationProperties(VexenProperties.class)
@ConditionalOnProperty(prefix = "vexen", name = "database-url")
public class VexenAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(VexenAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public VexenConfig vexenConfig(VexenProperties properties) {
        log.debug("Binding {}", properties);
        return properties.toConfig();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public VexenContainer vexenContainer(VexenConfig config, ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable(SimpleMeterRegistry::new);
        return ContainerScope.open(new VexenContainer(config, SubsystemFactories.defaults(), registry));
    }

    @Bean
    @ConditionalOnMissingBean
    public UserService vexenUserService(VexenContainer container) {
        return container.identity().users();
    }

    @Bean
    @ConditionalOnMissingBean
    public RoleService vexenRoleService(VexenContainer container) {
        return container.authorization().roles();
    }

    @Bean
    @ConditionalOnMissingBean
    public PermissionService vexenPermissionService(VexenContainer container) {
        return container.authorization().permissions();
    }

    @Bean
    @ConditionalOnMissingBean
    public AccessService vexenAccessService(VexenContainer container) {
        return container.authorization().access();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuthService vexenAuthService(VexenContainer container) {
        return container.authentication().service();
    }
}
