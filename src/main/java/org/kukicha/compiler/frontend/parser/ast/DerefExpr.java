package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

public record DerefExpr(Token token, Expression operand) implements Expression {
}
