package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

/**
 * {@code left |> right}. The right side must be a call, a method shorthand {@code .m(args)}
 * or a field shorthand {@code .f}.
 */
public record PipeExpr(Token token, Expression left, Expression right) implements Expression {
}
