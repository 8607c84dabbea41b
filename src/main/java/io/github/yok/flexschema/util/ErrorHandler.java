package io.github.yok.flexschema.util;

import io.github.yok.flexschema.parser.MalformedContentException;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports a fatal error of the schema inference command line.
 *
 * <p>
 * The cause chain is classified into a {@link Failure}: unreadable input
 * ({@link MalformedContentException}), a missing file, another I/O failure, an invalid argument or
 * an internal error. The error is logged through SLF4J and standard error receives the failure
 * label, the message, the root cause and a hint for the user. The JVM is never terminated here.
 * </p>
 *
 * <p>
 * Tests switch the current thread to "throw instead of report" with
 * {@link #disableExitForCurrentThread()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Kind of fatal failure, in the order the cause chain is matched.
     */
    @Getter
    @RequiredArgsConstructor
    public enum Failure {

        MALFORMED_INPUT("Malformed input",
                "Check the file encoding (reader.charset) and the --format option."),

        FILE_NOT_FOUND("File not found", "Check the --file path."),

        IO("I/O failure", "Check that the file is readable."),

        INVALID_ARGUMENT("Invalid argument",
                "Usage: --file <path> [--format <name>] [--delimiter <char>] [--no-header] "
                        + "[--widths <w1,w2,...>] [--pattern <regex>] [--context <name>]"),

        INTERNAL("Internal error", "See the log for the stack trace.");

        private final String label;

        private final String hint;
    }

    /**
     * Makes {@code errorAndExit} throw {@link IllegalStateException} on the current thread.
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restores normal reporting on the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Classifies a failure by the first recognized exception in its cause chain.
     *
     * @param cause failure, may be {@code null}
     * @return failure kind; {@link Failure#INTERNAL} when nothing is recognized
     */
    public static Failure classify(Throwable cause) {
        List<Throwable> chain = ExceptionUtils.getThrowableList(cause);
        for (Throwable t : chain) {
            if (t instanceof MalformedContentException) {
                return Failure.MALFORMED_INPUT;
            }
        }
        for (Throwable t : chain) {
            if (t instanceof FileNotFoundException || t instanceof NoSuchFileException) {
                return Failure.FILE_NOT_FOUND;
            }
            if (t instanceof IOException) {
                return Failure.IO;
            }
            if (t instanceof IllegalArgumentException) {
                return Failure.INVALID_ARGUMENT;
            }
        }
        return Failure.INTERNAL;
    }

    /**
     * Logs the message with the stack trace of the cause and prints the classified failure to
     * {@code System.err}.
     *
     * @param message message to report
     * @param cause root cause
     */
    public static void errorAndExit(String message, Throwable cause) {
        Failure failure = classify(cause);
        log.error("[{}] {}\n{}", failure, message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        String detail = ExceptionUtils.getRootCauseMessage(cause);
        StringBuilder out = new StringBuilder("ERROR [").append(failure.getLabel()).append("]: ")
                .append(message);
        if (StringUtils.isNotBlank(detail)) {
            out.append(System.lineSeparator()).append("Cause: ").append(detail);
        }
        out.append(System.lineSeparator()).append(failure.getHint());
        System.err.println(out);
    }

    /**
     * Logs an argument error and prints it with the usage hint to {@code System.err}.
     *
     * @param message message to report
     */
    public static void errorAndExit(String message) {
        log.error("[{}] {}", Failure.INVALID_ARGUMENT, message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR [" + Failure.INVALID_ARGUMENT.getLabel() + "]: " + message
                + System.lineSeparator() + Failure.INVALID_ARGUMENT.getHint());
    }
}
