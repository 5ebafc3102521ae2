package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

/**
 * @param alternative The else branch: a {@link BlockStmt}, a nested {@link IfStmt} for
 *                    {@code else if}, or null.
 */
public record IfStmt(Token token, Expression condition, BlockStmt consequence, Statement alternative) implements Statement {
}
