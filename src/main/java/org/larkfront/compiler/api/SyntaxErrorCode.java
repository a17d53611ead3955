package org.larkfront.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur while tokenizing or parsing.
 * This decouples the test logic from the human-readable error messages.
 */
public enum SyntaxErrorCode {
    // region Lexer Errors
    /** A '"' string was not closed before the end of input. */
    UNTERMINATED_STRING,
    /** A '"""' string was not closed before the end of input. */
    UNTERMINATED_MULTILINE_STRING,
    /** No punctuator spelling matches the character at the cursor. */
    UNRECOGNIZED_CHARACTER,
    // endregion

    // region Parser Errors
    /** 'load' was not followed by '('. */
    EXPECTED_LPAREN,
    /** The first argument of 'load' was not a string literal. */
    EXPECTED_MODULE_NAME,
    /** A symbol or the module name was not followed by ',' or ')'. */
    EXPECTED_COMMA_OR_RPAREN,
    /** A ',' in a load statement was followed by neither a string nor an identifier. */
    EXPECTED_SYMBOL,
    /** An alias identifier in a load statement was not followed by '='. */
    EXPECTED_EQUALS,
    /** An alias '=' in a load statement was not followed by a string literal. */
    EXPECTED_STRING_LITERAL,
    /** A load statement imports no symbols. */
    EMPTY_SYMBOL_LIST,
    /** The input ended where another token was required. */
    UNEXPECTED_END_OF_INPUT,
    /** A statement starts with a keyword that has no statement handler. */
    UNSUPPORTED_KEYWORD,
    /** A statement starts with a token that is not a keyword. */
    UNEXPECTED_TOKEN,
    // endregion

    // region General Errors
    /** An I/O error occurred while reading a source file. */
    IO_ERROR_READING_FILE
    // endregion
}
