package org.kukicha.compiler.frontend.parser.ast;

/**
 * A top-level declaration in a source file.
 */
public interface Declaration extends AstNode {
}
