package org.larkfront.compiler.frontend.lexer;

/**
 * The fixed set of operator and delimiter spellings of the language.
 * The {@link Lexer} matches them longest first, so several spellings may share a prefix.
 */
public enum Punctuator {
    // Arithmetic.
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    DOUBLE_SLASH("//"),
    PERCENT("%"),
    DOUBLE_STAR("**"),

    // Bitwise.
    TILDE("~"),
    AMPERSAND("&"),
    PIPE("|"),
    CARET("^"),
    LSHIFT("<<"),
    RSHIFT(">>"),

    // Delimiters.
    DOT("."),
    COMMA(","),
    EQUALS("="),
    SEMICOLON(";"),
    COLON(":"),
    LPAREN("("),
    RPAREN(")"),
    LBRACKET("["),
    RBRACKET("]"),
    LBRACE("{"),
    RBRACE("}"),

    // Comparison.
    LESS("<"),
    GREATER(">"),
    GREATER_OR_EQUAL(">="),
    LESS_OR_EQUAL("<="),
    EQUAL_EQUAL("=="),
    NOT_EQUAL("!="),

    // Compound assignment.
    PLUS_EQUALS("+="),
    MINUS_EQUALS("-="),
    STAR_EQUALS("*="),
    SLASH_EQUALS("/="),
    DOUBLE_SLASH_EQUALS("//="),
    PERCENT_EQUALS("%="),
    AMPERSAND_EQUALS("&="),
    PIPE_EQUALS("|="),
    CARET_EQUALS("^="),
    LSHIFT_EQUALS("<<="),
    RSHIFT_EQUALS(">>=");

    private final String spelling;

    Punctuator(String spelling) {
        this.spelling = spelling;
    }

    /**
     * Returns the exact source spelling of this punctuator.
     * @return The spelling, e.g. {@code "<<="}.
     */
    public String spelling() {
        return spelling;
    }
}
