package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

/**
 * {@code go call} or {@code go} followed by an indented block. Exactly one of the two is non-null.
 */
public record GoStmt(Token token, Expression call, BlockStmt block) implements Statement {
}
