package org.larkfront.compiler.frontend.lexer;

/**
 * A single token produced by the {@link Lexer}. Exactly one variant is active per instance.
 * <p>
 * Tokens carry no source position. The offset of the most recently scanned token is
 * available from {@link Lexer#tokenStart()} instead.
 */
public sealed interface Token permits Token.Punct, Token.Kw, Token.Identifier, Token.StringLiteral, Token.Eof {

    /** The shared end-of-input token. */
    Token EOF = new Eof();

    /**
     * Returns the coarse kind of this token.
     * @return The token type.
     */
    TokenType type();

    /**
     * Renders this token the way it is printed in token dumps.
     * @return The rendered text, e.g. {@code +=}, {@code load}, {@code "value"} or {@code <eof>}.
     */
    String text();

    /**
     * Checks whether this token is the given punctuator.
     * @param punctuator The punctuator to compare against.
     * @return true if this is a {@link Punct} holding {@code punctuator}.
     */
    default boolean is(Punctuator punctuator) {
        return this instanceof Punct punct && punct.punctuator() == punctuator;
    }

    /**
     * Checks whether this token is the given keyword.
     * @param keyword The keyword to compare against.
     * @return true if this is a {@link Kw} holding {@code keyword}.
     */
    default boolean is(Keyword keyword) {
        return this instanceof Kw kw && kw.keyword() == keyword;
    }

    /**
     * An operator or delimiter.
     * @param punctuator The matched punctuator.
     */
    record Punct(Punctuator punctuator) implements Token {
        @Override public TokenType type() { return TokenType.PUNCTUATOR; }
        @Override public String text() { return punctuator.spelling(); }
    }

    /**
     * A reserved word.
     * @param keyword The matched keyword.
     */
    record Kw(Keyword keyword) implements Token {
        @Override public TokenType type() { return TokenType.KEYWORD; }
        @Override public String text() { return keyword.word(); }
    }

    /**
     * A name that is not a keyword.
     * @param name The identifier text, never empty.
     */
    record Identifier(String name) implements Token {
        @Override public TokenType type() { return TokenType.IDENTIFIER; }
        @Override public String text() { return name; }
    }

    /**
     * A string literal. The value is the raw text between the quotes; escape
     * sequences are not decoded.
     * @param value The text between the delimiters.
     */
    record StringLiteral(String value) implements Token {
        @Override public TokenType type() { return TokenType.STRING; }
        @Override public String text() { return "\"" + value + "\""; }
    }

    /**
     * Marks the end of the source text.
     */
    record Eof() implements Token {
        @Override public TokenType type() { return TokenType.END_OF_FILE; }
        @Override public String text() { return "<eof>"; }
    }
}
