package com.vexen.lifecycle;

import com.vexen.observability.ComponentHealth;

/**
 * An independently-lifecycled unit wired by a Vexen container.
 * <p>
 * A subsystem is constructed from its configuration slice by a {@link SubsystemFactory}, which
 * performs no I/O. {@link #init()} opens whatever the subsystem needs (connection pools, schema
 * migrations) and {@link #close()} releases it. The container calls each at most once per
 * lifetime, from a single thread.
 * <p>
 * If {@link #init()} fails, the subsystem must release anything it already opened before
 * throwing: the caller only closes subsystems whose {@code init()} returned normally.
 */
public interface Subsystem extends AutoCloseable {

    /**
     * Short, stable name used in logs, health results and metrics (e.g., "identity").
     */
    String name();

    /**
     * Brings the subsystem up.
     *
     * @throws SubsystemException if the subsystem cannot be brought up
     * @throws IllegalStateException if called on a subsystem that is already initialized
     */
    void init();

    /**
     * Releases the subsystem's resources. Safe to call on a subsystem that was never initialized.
     * Implementations should attempt to release everything even when one step fails, then report
     * the failure.
     */
    @Override
    void close();

    /**
     * Probes the subsystem's backing resources.
     */
    ComponentHealth health();
}
