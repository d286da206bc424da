package com.vexen.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer instrumentation for subsystem bring-up and teardown.
 * <p>
 * Every phase a container runs for a subsystem is recorded on the {@value #DURATION_METRIC}
 * timer, tagged with the subsystem, the phase and its outcome. A {@value #READY_METRIC} gauge
 * reports 1 while the container is READY and 0 otherwise, until {@link #release()} removes it.
 */
public final class LifecycleMetrics {

    /** Timer recording how long each lifecycle phase took. */
    public static final String DURATION_METRIC = "vexen.lifecycle.duration";

    /** Gauge reporting whether the container is ready. */
    public static final String READY_METRIC = "vexen.lifecycle.ready";

    /** Tag key for the container instance. */
    public static final String TAG_CONTAINER = "container";

    /** Tag key for the subsystem name. */
    public static final String TAG_SUBSYSTEM = "subsystem";

    /** Tag key for the lifecycle phase. */
    public static final String TAG_PHASE = "phase";

    /** Tag key for the phase outcome. */
    public static final String TAG_OUTCOME = "outcome";

    /** Lifecycle phases a subsystem goes through. */
    public enum Phase {
        INIT("init"),
        CLOSE("close");

        private final String tagValue;

        Phase(String tagValue) {
            this.tagValue = tagValue;
        }

        public String tagValue() {
            return tagValue;
        }
    }

    private final MeterRegistry registry;
    private final String containerName;
    private final AtomicInteger ready = new AtomicInteger(0);
    private final Gauge readyGauge;

    /**
     * Creates metrics bound to the given registry.
     *
     * @param registry      the Micrometer meter registry
     * @param containerName name distinguishing this container's meters from other containers
     */
    public LifecycleMetrics(MeterRegistry registry, String containerName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (containerName == null || containerName.isBlank()) {
            throw new IllegalArgumentException("containerName must not be null or blank");
        }
        this.registry = registry;
        this.containerName = containerName;
        this.readyGauge = Gauge.builder(READY_METRIC, ready, AtomicInteger::doubleValue)
                .description("1 while the container is READY, 0 otherwise")
                .tags(Tags.of(TAG_CONTAINER, containerName))
                .strongReference(true)
                .register(registry);
    }

    /**
     * Records one lifecycle phase of a subsystem.
     *
     * @param subsystem subsystem name
     * @param phase     the phase that ran
     * @param nanos     elapsed time in nanoseconds
     * @param success   whether the phase completed without failure
     */
    public void record(String subsystem, Phase phase, long nanos, boolean success) {
        Timer.builder(DURATION_METRIC)
                .description("Duration of subsystem lifecycle phases")
                .tags(Tags.of(
                        TAG_CONTAINER, containerName,
                        TAG_SUBSYSTEM, subsystem,
                        TAG_PHASE, phase.tagValue(),
                        TAG_OUTCOME, success ? "success" : "failure"))
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    /** Marks the container as ready or not ready. */
    public void ready(boolean isReady) {
        ready.set(isReady ? 1 : 0);
    }

    /**
     * Removes the ready gauge from the registry. Phase timers stay registered.
     */
    public void release() {
        ready.set(0);
        registry.remove(readyGauge);
    }

    /** Returns the container name used as a tag. */
    public String containerName() {
        return containerName;
    }
}
