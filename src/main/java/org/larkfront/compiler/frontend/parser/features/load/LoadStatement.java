package org.larkfront.compiler.frontend.parser.features.load;

import org.larkfront.compiler.frontend.parser.ast.Statement;

import java.util.List;

/**
 * An AST node that represents a <code>load</code> statement.
 *
 * @param moduleName The label of the module to load from, e.g. {@code @rules_cc//cc:defs.bzl}.
 * @param symbols The imported symbols in source order; never empty.
 */
public record LoadStatement(
        String moduleName,
        List<LoadedSymbol> symbols
) implements Statement {

    public LoadStatement {
        if (symbols.isEmpty()) {
            throw new IllegalArgumentException("A load statement must import at least one symbol.");
        }
        symbols = List.copyOf(symbols);
    }

    /**
     * A single imported symbol.
     *
     * @param localName The name bound in the loading file.
     * @param exportedName The name under which the loaded module publishes the symbol.
     */
    public record LoadedSymbol(String localName, String exportedName) {

        /**
         * Creates a symbol that is bound under its exported name.
         * @param name The exported (and local) name.
         * @return The symbol.
         */
        public static LoadedSymbol of(String name) {
            return new LoadedSymbol(name, name);
        }

        /**
         * Checks whether the symbol is bound under a different local name.
         * @return true if the source used the {@code local = "exported"} form with distinct names.
         */
        public boolean isAliased() {
            return !localName.equals(exportedName);
        }
    }
}
