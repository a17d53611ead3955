package org.larkfront.compiler.frontend.parser.ast;

/**
 * A top-level statement of a {@link Program}. Load statements are the only kind today.
 */
public interface Statement extends AstNode {
}
