package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

/**
 * {@code target[start:end]}. Either bound may be null.
 */
public record SliceExpr(Token token, Expression target, Expression start, Expression end) implements Expression {
}
