package org.larkfront.compiler.frontend.parser.features.load;

import org.larkfront.compiler.api.ParseException;
import org.larkfront.compiler.api.SyntaxErrorCode;
import org.larkfront.compiler.frontend.lexer.Keyword;
import org.larkfront.compiler.frontend.lexer.Punctuator;
import org.larkfront.compiler.frontend.lexer.Token;
import org.larkfront.compiler.frontend.parser.ParsingContext;
import org.larkfront.compiler.frontend.parser.ast.Statement;
import org.larkfront.compiler.frontend.statement.IStatementHandler;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles the parsing of the <code>load</code> statement.
 * <p>
 * Syntax: <code>load '(' string {',' [identifier '='] string} ')'</code>
 */
public class LoadStatementHandler implements IStatementHandler {
    @Override public Keyword getKeyword() { return Keyword.LOAD; }

    /**
     * Parses a <code>load</code> statement. The first string names the module, every further
     * argument is either a symbol string or an {@code alias = "symbol"} pair.
     * @param context The parsing context.
     * @return A {@link LoadStatement} with at least one symbol.
     */
    @Override
    public Statement parse(ParsingContext context) throws ParseException {
        // 'load' was consumed by the parser.
        context.expect(Punctuator.LPAREN, SyntaxErrorCode.EXPECTED_LPAREN);
        String moduleName = context.expectString(SyntaxErrorCode.EXPECTED_MODULE_NAME, "module name");

        List<LoadStatement.LoadedSymbol> symbols = new ArrayList<>();
        while (true) {
            Token separator = context.advance();
            if (separator.is(Punctuator.RPAREN)) {
                break;
            }
            if (!separator.is(Punctuator.COMMA)) {
                throw context.error(SyntaxErrorCode.EXPECTED_COMMA_OR_RPAREN, "',' or ')'", separator);
            }

            Token symbol = context.advance();
            if (symbol instanceof Token.StringLiteral literal) {
                symbols.add(LoadStatement.LoadedSymbol.of(literal.value()));
            } else if (symbol instanceof Token.Identifier alias) {
                context.expect(Punctuator.EQUALS, SyntaxErrorCode.EXPECTED_EQUALS);
                String exportedName = context.expectString(SyntaxErrorCode.EXPECTED_STRING_LITERAL, "symbol name");
                symbols.add(new LoadStatement.LoadedSymbol(alias.name(), exportedName));
            } else {
                throw context.error(SyntaxErrorCode.EXPECTED_SYMBOL, "symbol string or alias", symbol);
            }
        }

        if (symbols.isEmpty()) {
            throw context.error(SyntaxErrorCode.EMPTY_SYMBOL_LIST, "at least one symbol", context.previous());
        }
        return new LoadStatement(moduleName, symbols);
    }
}
