package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

/**
 * {@code error "message"}: constructs a new error value.
 */
public record ErrorExpr(Token token, Expression message) implements Expression {
}
