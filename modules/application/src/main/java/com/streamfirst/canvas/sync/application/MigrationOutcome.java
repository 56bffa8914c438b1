package com.streamfirst.canvas.sync.application;

/**
 * Result of a one-time local-to-cloud migration attempt.
 */
public enum MigrationOutcome {
    ALREADY_MIGRATED,
    NOTHING_TO_MIGRATE,
    MIGRATED,
    /** Some writes failed; the flag is set anyway and they are not retried */
    MIGRATED_WITH_FAILURES,
    /** Legacy blob could not be read; the flag stays unset */
    FAILED,
    /** No backend configured; the flag stays unset so the migration runs once sync is enabled */
    SYNC_DISABLED,
    /** Called without a signed-in owner; nothing is read or written */
    NO_OWNER;

    public boolean isFlagSet() {
        return this != FAILED && this != SYNC_DISABLED && this != NO_OWNER;
    }
}
