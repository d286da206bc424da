package com.vexen.core;

/**
 * Thrown when a subsystem handle is requested from a container that is not {@link ContainerState#READY}.
 */
public class ContainerNotInitializedException extends IllegalStateException {

    private final ContainerState state;

    public ContainerNotInitializedException(ContainerState state) {
        super(state == ContainerState.CLOSED
                ? "VexenContainer is closed."
                : "VexenContainer not initialized. Call init() first.");
        this.state = state;
    }

    /** State of the container when the access was attempted. */
    public ContainerState state() {
        return state;
    }
}
