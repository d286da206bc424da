package com.vexen.database;

/**
 * Where a subsystem's Flyway migrations live and where their history is recorded.
 * <p>
 * Subsystems may share one database, so each keeps its own history table.
 *
 * @param name         subsystem name, also used for the pool name ({@code vexen-<name>})
 * @param location     Flyway location (e.g., {@code classpath:db/migration/identity})
 * @param historyTable schema history table (e.g., {@code vexen_identity_schema_history})
 */
public record MigrationPlan(String name, String location, String historyTable) {

    public MigrationPlan {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("location must not be null or blank");
        }
        if (historyTable == null || historyTable.isBlank()) {
            throw new IllegalArgumentException("historyTable must not be null or blank");
        }
    }

    /**
     * Conventional plan for a Vexen subsystem: migrations under {@code db/migration/<name>} and a
     * {@code vexen_<name>_schema_history} table.
     */
    public static MigrationPlan forSubsystem(String name) {
        return new MigrationPlan(name, "classpath:db/migration/" + name, "vexen_" + name + "_schema_history");
    }
}
