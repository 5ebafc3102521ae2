package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * Every node carries the first token it was parsed from, which serves as its source position.
 * <p>
 * Nodes are records and compare structurally. Side tables that attach information to
 * individual nodes must therefore be keyed by identity.
 */
public interface AstNode {

    /**
     * @return The token that starts this node.
     */
    Token token();
}
