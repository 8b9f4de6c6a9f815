package io.github.yok.spectramigrate.core;

import lombok.Getter;

/**
 * Fatal failure of a migration run.
 *
 * <p>
 * The {@link Kind} tells where the run stopped. Every kind ends the process with a non-zero exit
 * code; any open transaction has already been rolled back when this exception is thrown.
 * </p>
 */
@Getter
public class MigrationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Failure categories.
     */
    public enum Kind {
        /** The SQLite file does not exist. */
        SOURCE_NOT_FOUND,
        /** The SQLite file exists but cannot be opened. */
        SOURCE_CONNECTION,
        /** The PostgreSQL target is unreachable or rejects the login. */
        TARGET_CONNECTION,
        /** Counting rows before the run failed. */
        PRE_FLIGHT,
        /** A phase failed and its open transaction was rolled back. */
        PHASE_FAILED
    }

    private final Kind kind;

    /**
     * Creates the exception.
     *
     * @param kind failure category
     * @param message description
     */
    public MigrationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Creates the exception with a cause.
     *
     * @param kind failure category
     * @param message description
     * @param cause underlying failure
     */
    public MigrationException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
