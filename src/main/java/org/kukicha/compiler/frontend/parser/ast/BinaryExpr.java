package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

public record BinaryExpr(Token token, BinaryOperator operator, Expression left, Expression right) implements Expression {
}
