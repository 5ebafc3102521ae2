package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

import java.util.List;

public record MakeExpr(Token token, TypeRef type, List<Expression> args) implements Expression {

    public MakeExpr {
        args = List.copyOf(args);
    }
}
