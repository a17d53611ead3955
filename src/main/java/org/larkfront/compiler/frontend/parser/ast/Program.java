package org.larkfront.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The root of the AST: all statements of a source file in source order.
 *
 * @param statements The statements, in the order they appear (and execute).
 */
public record Program(List<Statement> statements) implements AstNode {

    public Program {
        statements = List.copyOf(statements);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(statements);
    }
}
