package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

/**
 * {@code for i from start to end} (exclusive) or {@code for i from start through end} (inclusive).
 */
public record ForNumericStmt(Token token, Identifier variable, Expression start, Expression end, boolean inclusive, BlockStmt body) implements Statement {
}
