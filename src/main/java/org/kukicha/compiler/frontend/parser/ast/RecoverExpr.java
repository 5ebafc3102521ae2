package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

public record RecoverExpr(Token token) implements Expression {
}
