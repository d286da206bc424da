package com.vexen.observability;

/**
 * Health result for one subsystem.
 *
 * @param name subsystem name (e.g., "identity", "authentication")
 * @param status health status of this subsystem
 * @param message optional human-readable detail, null when healthy
 * @param latencyMs time taken by the probe in milliseconds
 */
public record ComponentHealth(String name, HealthStatus status, String message, long latencyMs) {

    public ComponentHealth {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
    }

    /** Creates a healthy result. */
    public static ComponentHealth healthy(String name, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.HEALTHY, null, latencyMs);
    }

    /** Creates a degraded result. */
    public static ComponentHealth degraded(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.DEGRADED, message, latencyMs);
    }

    /** Creates an unhealthy result. */
    public static ComponentHealth unhealthy(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.UNHEALTHY, message, latencyMs);
    }

    /** Result for a subsystem that has not been brought up, so nothing was probed. */
    public static ComponentHealth notInitialized(String name) {
        return unhealthy(name, "not initialized", 0);
    }
}
