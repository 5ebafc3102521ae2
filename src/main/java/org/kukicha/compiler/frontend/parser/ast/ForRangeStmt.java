package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

/**
 * {@code for [index,] value in collection}.
 *
 * @param index The index variable, or null.
 */
public record ForRangeStmt(Token token, Identifier index, Identifier value, Expression collection, BlockStmt body) implements Statement {
}
