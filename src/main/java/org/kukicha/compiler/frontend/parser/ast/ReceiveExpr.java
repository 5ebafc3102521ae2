package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

/**
 * {@code receive from channel}.
 */
public record ReceiveExpr(Token token, Expression channel) implements Expression {
}
