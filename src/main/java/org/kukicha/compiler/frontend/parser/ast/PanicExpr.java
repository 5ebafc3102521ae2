package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

public record PanicExpr(Token token, Expression message) implements Expression {
}
