package io.github.yok.spectramigrate.util;

import io.github.yok.spectramigrate.core.MigrationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that logs a fatal migration error and echoes a concise message to
 * {@code System.err}.
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Logs the error (with stack trace) using SLF4J.</li>
 * <li>Writes a one-line message to {@code System.err} so operators see it without the log
 * file.</li>
 * <li>Does not terminate the JVM; the entry point maps the failure to {@link #EXIT_FAILURE}.</li>
 * <li>Tests can switch to "throw instead" for the current thread.</li>
 * </ul>
 */
@Slf4j
public class ErrorHandler {

    /**
     * Process exit code reported for any fatal error.
     */
    public static final int EXIT_FAILURE = 1;

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Switches the current thread to "throw {@link IllegalStateException} instead of reporting"
     * (useful for tests).
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restores normal behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Reports a fatal {@link MigrationException}, prefixing the message with its error kind.
     *
     * @param e failure to report
     */
    public static void fatal(MigrationException e) {
        errorAndExit("[" + e.getKind() + "] " + e.getMessage(),
                e.getCause() != null ? e.getCause() : e);
    }

    /**
     * Logs the message and root cause at error level and prints a concise message to
     * {@code System.err}.
     *
     * @param message message to log
     * @param cause root cause
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + ExceptionUtils.getRootCauseMessage(cause));
    }

    /**
     * Logs the message at error level and prints it to {@code System.err}.
     *
     * @param message message to log
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }
}
