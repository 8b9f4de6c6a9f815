package io.github.yok.spectramigrate.core;

import java.util.Locale;

/**
 * Phases of a migration run, declared in execution order.
 */
public enum MigrationPhase {

    /** Insert spectra missing from the target. */
    SPECTRA,

    /** Set {@code has_spectrum} on target markers still unflagged. */
    SPECTRUM_FLAGS,

    /** Copy GPS speed into target markers whose speed is unset. */
    SPEED,

    /** Fill channel data of target spectra whose channels are still NULL. */
    CHANNELS,

    /** Move the target spectrum id sequence past the copied ids. */
    SEQUENCES;

    /**
     * Resolves a phase from user input such as {@code spectrum-flags} or {@code speed}.
     *
     * @param value phase text
     * @return matching phase
     * @throws IllegalArgumentException if the text names no phase
     */
    public static MigrationPhase parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Phase must not be null");
        }
        return MigrationPhase.valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
