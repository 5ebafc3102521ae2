package org.kukicha.compiler.frontend.parser.ast;

/**
 * A node that produces a value.
 */
public interface Expression extends AstNode {
}
