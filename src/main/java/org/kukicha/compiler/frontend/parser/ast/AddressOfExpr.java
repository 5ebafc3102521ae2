package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

/**
 * {@code reference of x}.
 */
public record AddressOfExpr(Token token, Expression operand) implements Expression {
}
