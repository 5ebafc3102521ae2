package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

/**
 * {@code not x}, {@code !x} or {@code -x}.
 */
public record UnaryExpr(Token token, Operator operator, Expression operand) implements Expression {

    public enum Operator {
        NOT,
        NEGATE
    }
}
