package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

/**
 * {@code expression as Type}.
 */
public record TypeCastExpr(Token token, Expression expression, TypeRef target) implements Expression {
}
