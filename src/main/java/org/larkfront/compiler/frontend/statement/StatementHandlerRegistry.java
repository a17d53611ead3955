package org.larkfront.compiler.frontend.statement;

import org.larkfront.compiler.frontend.lexer.Keyword;
import org.larkfront.compiler.frontend.parser.features.load.LoadStatementHandler;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for statement handlers. This class holds a map of leading keywords
 * to their corresponding handlers.
 */
public class StatementHandlerRegistry {
    private final Map<Keyword, IStatementHandler> handlers = new EnumMap<>(Keyword.class);

    /**
     * Registers a new statement handler under its keyword, replacing any previous one.
     * @param handler The handler for the statement.
     */
    public void register(IStatementHandler handler) {
        handlers.put(handler.getKeyword(), handler);
    }

    /**
     * Gets the handler for a given keyword.
     * @param keyword The leading keyword of a statement.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<IStatementHandler> get(Keyword keyword) {
        return Optional.ofNullable(handlers.get(keyword));
    }

    /**
     * Initializes the registry with all the built-in handlers.
     * @return A new instance of {@link StatementHandlerRegistry} with all handlers registered.
     */
    public static StatementHandlerRegistry initialize() {
        StatementHandlerRegistry registry = new StatementHandlerRegistry();
        registry.register(new LoadStatementHandler());
        return registry;
    }
}
