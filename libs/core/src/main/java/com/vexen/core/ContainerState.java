package com.vexen.core;

/**
 * Lifecycle states of a {@link VexenContainer}.
 */
public enum ContainerState {
    /** Constructed, or a previous {@code init()} failed. */
    UNINITIALIZED,
    /** All subsystems are initialized. */
    READY,
    /** Closed for good. */
    CLOSED
}
