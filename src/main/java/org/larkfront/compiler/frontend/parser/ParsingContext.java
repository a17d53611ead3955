package org.larkfront.compiler.frontend.parser;

import org.larkfront.compiler.api.ParseException;
import org.larkfront.compiler.api.SyntaxErrorCode;
import org.larkfront.compiler.frontend.lexer.Punctuator;
import org.larkfront.compiler.frontend.lexer.Token;

/**
 * An interface that encapsulates the token stream during parsing.
 * It provides statement handlers with access to the tokens without coupling them
 * directly to the parser. Tokens are pulled one at a time and never pushed back.
 */
public interface ParsingContext {

    /**
     * Consumes the next token and returns it.
     * @return The consumed token; {@link Token#EOF} once the input is exhausted.
     * @throws ParseException if the lexer fails.
     */
    Token advance() throws ParseException;

    /**
     * Returns the previously consumed token.
     * @return The previous token, or {@code null} before the first call to {@link #advance()}.
     */
    Token previous();

    /**
     * Consumes the next token and requires it to be the given punctuator.
     * @param punctuator The expected punctuator.
     * @param code The error code to report if a different token is found.
     * @throws ParseException if the token does not match.
     */
    void expect(Punctuator punctuator, SyntaxErrorCode code) throws ParseException;

    /**
     * Consumes the next token and requires it to be a string literal.
     * @param code The error code to report if a different token is found.
     * @param description What the string stands for, used in the error message.
     * @return The value of the string literal.
     * @throws ParseException if the token is not a string literal.
     */
    String expectString(SyntaxErrorCode code, String description) throws ParseException;

    /**
     * Creates the exception for a token that does not fit the grammar. If the token is the end of
     * input, the error is reported as {@link SyntaxErrorCode#UNEXPECTED_END_OF_INPUT}.
     * @param code The error code.
     * @param expected A description of what was expected.
     * @param actual The offending token, which must be the most recently consumed one.
     * @return The exception, for the caller to throw.
     */
    ParseException error(SyntaxErrorCode code, String expected, Token actual);
}
