package com.vexen.observability;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate health of every subsystem owned by a container.
 *
 * @param status overall health, the worst of the component statuses
 * @param components per-subsystem results keyed by subsystem name, in bring-up order
 * @param timestamp when the probes were run
 */
public record HealthResult(HealthStatus status, Map<String, ComponentHealth> components, Instant timestamp) {

    public HealthResult {
        components = Collections.unmodifiableMap(new LinkedHashMap<>(components));
    }

    /**
     * Aggregates component results. An empty list is reported as {@link HealthStatus#UNHEALTHY}
     * since there is nothing that could serve requests.
     *
     * @param components results in the order they should be reported
     * @param timestamp probe time
     * @return the aggregate result
     */
    public static HealthResult aggregate(List<ComponentHealth> components, Instant timestamp) {
        if (components.isEmpty()) {
            return new HealthResult(HealthStatus.UNHEALTHY, Map.of(), timestamp);
        }
        Map<String, ComponentHealth> byName = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.HEALTHY;
        for (ComponentHealth component : components) {
            byName.put(component.name(), component);
            overall = overall.worst(component.status());
        }
        return new HealthResult(overall, byName, timestamp);
    }

    /** Whether the aggregate status is {@link HealthStatus#HEALTHY}. */
    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }
}
