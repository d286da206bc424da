package com.vexen.observability;

/**
 * Health status for a single subsystem or for the container as a whole.
 */
public enum HealthStatus {

    /** The subsystem is initialized and its backing resources answer probes. */
    HEALTHY,

    /** The subsystem answers, but slower or with reduced capacity. */
    DEGRADED,

    /** The subsystem is not initialized or a probe of its resources failed. */
    UNHEALTHY;

    /**
     * Combines two statuses, keeping the worse of the two.
     */
    public HealthStatus worst(HealthStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
