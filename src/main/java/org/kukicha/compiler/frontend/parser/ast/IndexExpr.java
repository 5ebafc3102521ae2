package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

public record IndexExpr(Token token, Expression target, Expression index) implements Expression {
}
