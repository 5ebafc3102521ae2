package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

import java.util.List;

/**
 * {@code object.method(args)}. The object is null for the pipe shorthand {@code .method(args)}.
 */
public record MethodCallExpr(Token token, Expression object, String method, List<Expression> args, boolean spread) implements Expression {

    public MethodCallExpr {
        args = List.copyOf(args);
    }

    public boolean isShorthand() {
        return object == null;
    }
}
