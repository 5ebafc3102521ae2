package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

/**
 * {@code for cond}, or an infinite {@code for} when the condition is null.
 */
public record ForConditionStmt(Token token, Expression condition, BlockStmt body) implements Statement {
}
