package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

/**
 * {@code empty}, {@code nil} or {@code empty T}. The type is null for the untyped form.
 */
public record EmptyExpr(Token token, TypeRef type) implements Expression {
}
