package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

import java.util.List;

/**
 * An anonymous function with a block body: {@code func(x int) int} + indented block.
 */
public record FunctionLiteral(Token token, List<Parameter> params, List<TypeRef> returns, BlockStmt body) implements Expression {

    public FunctionLiteral {
        params = List.copyOf(params);
        returns = List.copyOf(returns);
    }
}
