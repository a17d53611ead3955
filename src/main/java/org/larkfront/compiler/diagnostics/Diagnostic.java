package org.larkfront.compiler.diagnostics;

import org.larkfront.compiler.api.SyntaxErrorCode;

/**
 * Represents a single diagnostic message that occurs while tokenizing or parsing.
 *
 * @param type The type of the diagnostic.
 * @param code The error code identifying the kind of problem.
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param offset The UTF-8 byte offset of the issue within the file.
 */
public record Diagnostic(
        Type type,
        SyntaxErrorCode code,
        String message,
        String fileName,
        int offset
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that aborts tokenizing or parsing. */
        ERROR
    }

    @Override
    public String toString() {
        return String.format("[%s] %s@%d: %s (%s)", type, fileName, offset, message, code);
    }
}
