package io.github.yok.spectramigrate.transform;

/**
 * Signals that one source value cannot be converted for the target.
 *
 * <p>
 * Recoverable: the copier logs the row, skips it and continues with the next one.
 * </p>
 */
public class RowTransformException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message description of the rejected value
     */
    public RowTransformException(String message) {
        super(message);
    }

    /**
     * Creates the exception with a cause.
     *
     * @param message description of the rejected value
     * @param cause parse failure
     */
    public RowTransformException(String message, Throwable cause) {
        super(message, cause);
    }
}
