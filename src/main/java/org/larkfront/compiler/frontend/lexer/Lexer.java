package org.larkfront.compiler.frontend.lexer;

import org.larkfront.compiler.api.ParseException;
import org.larkfront.compiler.api.SyntaxError;
import org.larkfront.compiler.api.SyntaxErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Tokens are produced on demand by {@link #nextToken()}; the only state is the cursor
 * into the source. A Lexer is not thread-safe.
 */
public class Lexer {

    private static final Logger LOGGER = LoggerFactory.getLogger(Lexer.class);

    private static final String TRIPLE_QUOTE = "\"\"\"";

    /** All punctuators, longest spelling first, so that '<<=' wins over '<<' and '<'. */
    private static final List<Punctuator> PUNCTUATORS = Arrays.stream(Punctuator.values())
            .sorted(Comparator.comparingInt((Punctuator p) -> p.spelling().length()).reversed())
            .toList();

    private final String source;
    private int start = 0;
    private int current = 0;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return The recognized tokens, without the trailing end-of-input token.
     * @throws ParseException on the first lexical error; no partial result is returned.
     */
    public List<Token> scanTokens() throws ParseException {
        List<Token> tokens = new ArrayList<>();
        for (Token token = nextToken(); token.type() != TokenType.END_OF_FILE; token = nextToken()) {
            tokens.add(token);
        }
        LOGGER.trace("Scanned {} tokens from {} characters", tokens.size(), source.length());
        return tokens;
    }

    /**
     * Scans the next token. Once the end of input is reached, every further call returns {@link Token#EOF}.
     * @return The next token.
     * @throws ParseException if the text at the cursor cannot be turned into a token.
     */
    public Token nextToken() throws ParseException {
        skipWhitespaceAndComments();
        start = current;

        if (isAtEnd()) {
            return Token.EOF;
        }

        Token token;
        if (source.startsWith(TRIPLE_QUOTE, current)) {
            token = multilineString();
        } else if (peek() == '"') {
            token = string();
        } else if (isAlpha(peek())) {
            token = identifier();
        } else {
            token = punctuator();
        }
        LOGGER.trace("Token {} at offset {}", token, start);
        return token;
    }

    /**
     * Returns the UTF-8 byte offset at which the most recently scanned token starts.
     * For {@link Token#EOF} this is the encoded length of the source.
     * @return The start offset of the last token.
     */
    public int tokenStart() {
        return byteOffset(start);
    }

    /**
     * Returns the part of the source that has not been consumed yet.
     * @return The remaining input, starting at the cursor.
     */
    public String remainingInput() {
        return source.substring(current);
    }

    private int byteOffset(int charOffset) {
        return source.substring(0, charOffset).getBytes(StandardCharsets.UTF_8).length;
    }

    private void skipWhitespaceAndComments() {
        boolean skipped = true;
        while (skipped) {
            skipped = false;
            while (!isAtEnd() && isWhitespace(peek())) advance();

            if (!isAtEnd() && peek() == '#') {
                skipped = true;
                // A comment goes until the end of the line.
                while (!isAtEnd() && peek() != '\n') advance();
            }
        }
    }

    // TODO: decode escape sequences such as \" and \n in both string forms.
    private Token multilineString() throws ParseException {
        current += TRIPLE_QUOTE.length();
        int valueStart = current;

        while (!isAtEnd() && !source.startsWith(TRIPLE_QUOTE, current)) advance();

        if (isAtEnd()) {
            throw new ParseException(SyntaxError.lexical(
                    SyntaxErrorCode.UNTERMINATED_MULTILINE_STRING, byteOffset(start), "Unterminated multiline string."));
        }

        String value = source.substring(valueStart, current);
        current += TRIPLE_QUOTE.length();
        return new Token.StringLiteral(value);
    }

    private Token string() throws ParseException {
        advance(); // The opening "
        int valueStart = current;

        while (!isAtEnd() && peek() != '"') advance();

        if (isAtEnd()) {
            throw new ParseException(SyntaxError.lexical(
                    SyntaxErrorCode.UNTERMINATED_STRING, byteOffset(start), "Unterminated string."));
        }

        String value = source.substring(valueStart, current);
        advance(); // The closing "
        return new Token.StringLiteral(value);
    }

    private Token identifier() {
        while (!isAtEnd() && isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        return Keyword.fromWord(text)
                .<Token>map(Token.Kw::new)
                .orElseGet(() -> new Token.Identifier(text));
    }

    private Token punctuator() throws ParseException {
        for (Punctuator punctuator : PUNCTUATORS) {
            if (source.startsWith(punctuator.spelling(), current)) {
                current += punctuator.spelling().length();
                return new Token.Punct(punctuator);
            }
        }
        throw new ParseException(SyntaxError.lexical(
                SyntaxErrorCode.UNRECOGNIZED_CHARACTER, byteOffset(start), "Unexpected character: " + peek()));
    }

    private void advance() {
        current++;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
