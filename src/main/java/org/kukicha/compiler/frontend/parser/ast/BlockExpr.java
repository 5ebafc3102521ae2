package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

/**
 * An indented block used as an onerr handler.
 */
public record BlockExpr(Token token, BlockStmt body) implements Expression {
}
