package io.github.yok.flexschema.parser;

/**
 * Signals that input content cannot be decoded or read as the requested format at all.
 *
 * <p>
 * This is the only hard failure of schema inference. Local anomalies (a stray line, a row with
 * missing cells) are absorbed by the record sources instead.
 * </p>
 */
public class MalformedContentException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public MalformedContentException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and cause.
     *
     * @param message detail message
     * @param cause underlying failure
     */
    public MalformedContentException(String message, Throwable cause) {
        super(message, cause);
    }
}
