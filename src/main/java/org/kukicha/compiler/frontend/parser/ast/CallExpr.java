package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

import java.util.List;

/**
 * @param function The callee: an {@link Identifier} or a qualified {@link SelectorExpr}.
 * @param spread   Whether the last argument was passed with {@code many}.
 */
public record CallExpr(Token token, Expression function, List<Expression> args, boolean spread) implements Expression {

    public CallExpr {
        args = List.copyOf(args);
    }
}
