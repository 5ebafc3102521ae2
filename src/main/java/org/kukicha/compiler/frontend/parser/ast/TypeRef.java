package org.kukicha.compiler.frontend.parser.ast;

/**
 * A type annotation as written in source, before resolution by the semantic analyzer.
 */
public interface TypeRef extends AstNode {
}
