package io.github.yok.cleansync.util;

import io.github.yok.cleansync.exception.AuthException;
import io.github.yok.cleansync.exception.ListException;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that reports a fatal setup failure of a sync run.
 *
 * <p>
 * Per-file failures never reach this class; they end up in the audit log. Only failures that stop
 * the run as a whole (authentication, listing of the root or destination container, missing
 * options) are routed here.
 * </p>
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Logs the error using SLF4J.</li>
 * <li>Writes a concise message to {@code System.err}.</li>
 * <li>Does not terminate the JVM by itself; callers turn {@link #exitCodeFor(Throwable)} into the
 * process exit status.</li>
 * <li>In tests, callers can switch behavior to throwing an exception via thread-local flags.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    /** Exit status for usage errors and unexpected failures. */
    public static final int EXIT_GENERAL = 1;

    /** Exit status when credentials could not be established. */
    public static final int EXIT_AUTH = 3;

    /** Exit status when a container could not be listed. */
    public static final int EXIT_LIST = 4;

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private ErrorHandler() {}

    /**
     * Switch to "throw exception instead of reporting" for the current thread (useful for tests).
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restore normal behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Logs the given message and root cause at error level and prints a concise message to
     * {@code System.err}.
     *
     * @param message message to log
     * @param cause root cause
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + ExceptionUtils.getRootCauseMessage(cause));
    }

    /**
     * Logs the given message at error level and prints it to {@code System.err}.
     *
     * @param message message to log
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }

    /**
     * Maps a fatal failure to the process exit status.
     *
     * @param cause failure that stopped the run
     * @return {@link #EXIT_AUTH}, {@link #EXIT_LIST} or {@link #EXIT_GENERAL}
     */
    public static int exitCodeFor(Throwable cause) {
        if (cause instanceof AuthException) {
            return EXIT_AUTH;
        }
        if (cause instanceof ListException) {
            return EXIT_LIST;
        }
        return EXIT_GENERAL;
    }
}
