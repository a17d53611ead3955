package org.larkfront.compiler.frontend.lexer;

/**
 * Defines the coarse kinds of tokens that the {@link Lexer} can produce.
 * Every {@link Token} variant maps to exactly one of these.
 */
public enum TokenType {
    /** An operator or delimiter, such as '+=' or '('. */
    PUNCTUATOR,
    /** A reserved word, such as 'load' or 'def'. */
    KEYWORD,
    /** A name that is not a reserved word. */
    IDENTIFIER,
    /** A single-line or triple-quoted string literal. */
    STRING,
    /** Represents the end of the source text. */
    END_OF_FILE
}
