package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

public record ExpressionStmt(Token token, Expression expression, OnErrClause onErr) implements Statement {
}
