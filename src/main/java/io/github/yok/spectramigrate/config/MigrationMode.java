package io.github.yok.spectramigrate.config;

/**
 * Execution mode of a migration run.
 */
public enum MigrationMode {

    /**
     * Computes and logs the migration plan without writing to the target.
     */
    DRY_RUN,

    /**
     * Runs the selected phases against the target.
     */
    APPLY
}
