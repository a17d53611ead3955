package org.larkfront.compiler.api;

import org.larkfront.compiler.frontend.lexer.Token;

/**
 * A structured description of the first error that aborted tokenizing or parsing.
 *
 * @param code The kind of error.
 * @param offset The UTF-8 byte offset into the source at which the error was detected.
 * @param expected A description of what was expected, or {@code null} for lexer errors.
 * @param actual The token that was found instead, or {@code null} for lexer errors.
 * @param message A human-readable message.
 */
public record SyntaxError(
        SyntaxErrorCode code,
        int offset,
        String expected,
        Token actual,
        String message
) {

    /**
     * Creates an error for a character sequence the lexer could not turn into a token.
     * @param code The error code.
     * @param offset The offset of the offending character sequence.
     * @param message The message.
     * @return The error.
     */
    public static SyntaxError lexical(SyntaxErrorCode code, int offset, String message) {
        return new SyntaxError(code, offset, null, null, message);
    }

    /**
     * Creates an error for a token that does not fit the grammar.
     * @param code The error code.
     * @param offset The offset at which {@code actual} starts.
     * @param expected What the grammar required at this point.
     * @param actual The token that was found.
     * @return The error.
     */
    public static SyntaxError unexpected(SyntaxErrorCode code, int offset, String expected, Token actual) {
        return new SyntaxError(code, offset, expected, actual, "Expected " + expected + ", got " + actual.text() + ".");
    }

    @Override
    public String toString() {
        return String.format("%s at offset %d: %s", code, offset, message);
    }
}
