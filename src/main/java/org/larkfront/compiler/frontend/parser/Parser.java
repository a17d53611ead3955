package org.larkfront.compiler.frontend.parser;

import org.larkfront.compiler.api.ParseException;
import org.larkfront.compiler.api.SyntaxError;
import org.larkfront.compiler.api.SyntaxErrorCode;
import org.larkfront.compiler.frontend.lexer.Lexer;
import org.larkfront.compiler.frontend.lexer.Punctuator;
import org.larkfront.compiler.frontend.lexer.Token;
import org.larkfront.compiler.frontend.lexer.TokenType;
import org.larkfront.compiler.frontend.parser.ast.Program;
import org.larkfront.compiler.frontend.parser.ast.Statement;
import org.larkfront.compiler.frontend.statement.IStatementHandler;
import org.larkfront.compiler.frontend.statement.StatementHandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The main parser. It pulls tokens from a {@link Lexer} one at a time and produces a {@link Program}.
 * <p>
 * Grammar: <code>Program = {Statement} Eof</code>, where each statement is introduced by a keyword
 * with a registered {@link IStatementHandler}. The first error aborts the whole parse.
 */
public class Parser implements ParsingContext {

    private static final Logger LOGGER = LoggerFactory.getLogger(Parser.class);

    private final Lexer lexer;
    private final StatementHandlerRegistry statementRegistry;
    private Token previous;

    /**
     * Constructs a new Parser over the given source text.
     * @param source The complete source text.
     */
    public Parser(String source) {
        this(new Lexer(source), StatementHandlerRegistry.initialize());
    }

    /**
     * Constructs a new Parser with an explicit lexer and handler registry.
     * @param lexer The lexer to pull tokens from; owned by this parser from now on.
     * @param statementRegistry The handlers for the supported statements.
     */
    public Parser(Lexer lexer, StatementHandlerRegistry statementRegistry) {
        this.lexer = lexer;
        this.statementRegistry = statementRegistry;
    }

    /**
     * Parses the entire token stream.
     * <p>
     * A statement that starts with a keyword without a handler fails the whole parse, so the
     * statements parsed before it are discarded as well.
     *
     * @return The program, containing every statement in source order.
     * @throws ParseException on the first lexical or syntax error.
     */
    public Program parse() throws ParseException {
        List<Statement> statements = new ArrayList<>();
        while (true) {
            Token token = advance();
            if (token.type() == TokenType.END_OF_FILE) {
                LOGGER.debug("Parsed {} statement(s)", statements.size());
                return new Program(statements);
            }
            statements.add(statement(token));
        }
    }

    private Statement statement(Token leading) throws ParseException {
        if (!(leading instanceof Token.Kw keyword)) {
            throw error(SyntaxErrorCode.UNEXPECTED_TOKEN, "a statement", leading);
        }

        Optional<IStatementHandler> handler = statementRegistry.get(keyword.keyword());
        if (handler.isEmpty()) {
            throw error(SyntaxErrorCode.UNSUPPORTED_KEYWORD, "a supported statement", leading);
        }
        return handler.get().parse(this);
    }

    @Override
    public Token advance() throws ParseException {
        previous = lexer.nextToken();
        return previous;
    }

    @Override
    public Token previous() {
        return previous;
    }

    @Override
    public void expect(Punctuator punctuator, SyntaxErrorCode code) throws ParseException {
        Token token = advance();
        if (!token.is(punctuator)) {
            throw error(code, "'" + punctuator.spelling() + "'", token);
        }
    }

    @Override
    public String expectString(SyntaxErrorCode code, String description) throws ParseException {
        Token token = advance();
        if (token instanceof Token.StringLiteral literal) {
            return literal.value();
        }
        throw error(code, description, token);
    }

    @Override
    public ParseException error(SyntaxErrorCode code, String expected, Token actual) {
        SyntaxErrorCode effectiveCode = actual.type() == TokenType.END_OF_FILE
                ? SyntaxErrorCode.UNEXPECTED_END_OF_INPUT
                : code;
        SyntaxError error = SyntaxError.unexpected(effectiveCode, lexer.tokenStart(), expected, actual);
        LOGGER.debug("Syntax error: {}", error);
        return new ParseException(error);
    }
}
