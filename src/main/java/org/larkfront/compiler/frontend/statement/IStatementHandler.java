package org.larkfront.compiler.frontend.statement;

import org.larkfront.compiler.api.ParseException;
import org.larkfront.compiler.frontend.lexer.Keyword;
import org.larkfront.compiler.frontend.parser.ParsingContext;
import org.larkfront.compiler.frontend.parser.ast.Statement;

/**
 * The base interface for all statement handlers.
 * Each handler is responsible for parsing the statement introduced by one keyword (e.g., "load").
 */
public interface IStatementHandler {

    /**
     * Specifies the keyword that introduces the statement handled here.
     * @return The leading keyword.
     */
    Keyword getKeyword();

    /**
     * Parses the statement. The leading keyword has already been consumed by the parser.
     *
     * @param context The context that provides access to the token stream.
     * @return The AST node for the statement.
     * @throws ParseException if the statement is malformed.
     */
    Statement parse(ParsingContext context) throws ParseException;
}
