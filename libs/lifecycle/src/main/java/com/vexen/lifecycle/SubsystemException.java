package com.vexen.lifecycle;

/**
 * Thrown when a subsystem cannot be brought up.
 */
public class SubsystemException extends RuntimeException {

    private final String subsystem;

    public SubsystemException(String subsystem, String message) {
        super("[%s] %s".formatted(subsystem, message));
        this.subsystem = subsystem;
    }

    public SubsystemException(String subsystem, String message, Throwable cause) {
        super("[%s] %s".formatted(subsystem, message), cause);
        this.subsystem = subsystem;
    }

    /** Name of the subsystem that failed. */
    public String subsystem() {
        return subsystem;
    }
}
