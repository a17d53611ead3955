package org.larkfront.compiler.api;

/**
 * An exception that is thrown when tokenizing or parsing fails.
 * <p>
 * It is part of the public API. The first error aborts the whole operation, so every
 * instance carries exactly one {@link SyntaxError}.
 */
public class ParseException extends Exception {

    private final SyntaxError error;

    /**
     * Constructs a new parse exception for the given error.
     * @param error The structured error.
     */
    public ParseException(SyntaxError error) {
        super(error.toString());
        this.error = error;
    }

    /**
     * Constructs a new parse exception for the given error and cause.
     * @param error The structured error.
     * @param cause The cause.
     */
    public ParseException(SyntaxError error, Throwable cause) {
        super(error.toString(), cause);
        this.error = error;
    }

    /**
     * Returns the structured error.
     * @return The error that aborted the operation.
     */
    public SyntaxError getError() {
        return error;
    }
}
