package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

import java.util.List;

/**
 * {@code (x T) => expr} or {@code x => expr}, or an arrow followed by an indented block.
 * Exactly one of {@code body} and {@code block} is non-null.
 */
public record ArrowLambda(Token token, List<Parameter> params, Expression body, BlockStmt block) implements Expression {

    public ArrowLambda {
        params = List.copyOf(params);
    }
}
