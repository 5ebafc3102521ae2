package org.kukicha.compiler.frontend.parser.ast;

/**
 * A statement inside a function body.
 */
public interface Statement extends AstNode {
}
