package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

public record CloseExpr(Token token, Expression channel) implements Expression {
}
