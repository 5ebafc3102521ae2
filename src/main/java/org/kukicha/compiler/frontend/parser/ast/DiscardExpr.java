package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

public record DiscardExpr(Token token) implements Expression {
}
