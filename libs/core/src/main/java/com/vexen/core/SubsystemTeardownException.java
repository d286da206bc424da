package com.vexen.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Failures raised by subsystems while the container was closing them, in teardown order.
 * Each failure is also attached as a suppressed exception.
 */
public class SubsystemTeardownException extends RuntimeException {

    private final Map<String, RuntimeException> failures;

    public SubsystemTeardownException(Map<String, RuntimeException> failures) {
        super("Failed to close subsystem(s): " + String.join(", ", failures.keySet()));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        this.failures.values().forEach(this::addSuppressed);
    }

    /** Failure per subsystem name. */
    public Map<String, RuntimeException> failures() {
        return failures;
    }
}
