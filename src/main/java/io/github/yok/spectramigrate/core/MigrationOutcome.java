package io.github.yok.spectramigrate.core;

/**
 * How a run ended without a fatal error. All outcomes map to exit code 0.
 */
public enum MigrationOutcome {
    NOTHING_TO_DO,
    DRY_RUN,
    CANCELLED,
    COMPLETED,
    COMPLETED_WITH_WARNINGS
}
