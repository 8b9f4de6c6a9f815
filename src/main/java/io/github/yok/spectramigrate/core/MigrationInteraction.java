package io.github.yok.spectramigrate.core;

/**
 * User decisions a run may need. Implemented by the entry point, which owns the console.
 */
public interface MigrationInteraction {

    /**
     * Supplies the target password when none is configured.
     *
     * @param user target user
     * @return password, may be empty
     */
    String requestPassword(String user);

    /**
     * Asks whether an apply run may write.
     *
     * @param plan the plan about to be executed
     * @return true to proceed
     */
    boolean confirm(MigrationPlan plan);
}
