package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

import java.util.List;

/**
 * {@code return values} used as an onerr handler.
 */
public record ReturnExpr(Token token, List<Expression> values) implements Expression {

    public ReturnExpr {
        values = List.copyOf(values);
    }
}
